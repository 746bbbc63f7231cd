package com.knowledgecenter.backend.modules.auth.application;

import java.time.Instant;
import java.util.List;

/**
 * Claims read from a validated access token. Claims absent from the token are empty
 * strings or an empty role list.
 */
public record AccessTokenClaims(
        String subject,
        String userId,
        String loginId,
        String email,
        List<String> roles,
        String tokenId,
        Instant issuedAt,
        Instant expiresAt,
        String issuer
) {

    public AccessTokenClaims {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }
}
