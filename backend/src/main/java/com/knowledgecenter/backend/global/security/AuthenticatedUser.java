package com.knowledgecenter.backend.global.security;

import java.util.List;

import com.knowledgecenter.backend.modules.auth.application.AccessTokenClaims;

/**
 * Principal bound to the security context for a request carrying a valid access token.
 */
public record AuthenticatedUser(String userId, List<String> roles, AccessTokenClaims claims) {

    public AuthenticatedUser {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public static AuthenticatedUser from(AccessTokenClaims claims) {
        return new AuthenticatedUser(claims.userId(), claims.roles(), claims);
    }
}
