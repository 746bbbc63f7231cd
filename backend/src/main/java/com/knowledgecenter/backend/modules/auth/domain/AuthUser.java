package com.knowledgecenter.backend.modules.auth.domain;

import java.util.Map;
import java.util.UUID;

/**
 * Identity as seen by the authentication core. {@code passwordHash} is empty when the
 * account has no password and therefore cannot log in.
 */
public record AuthUser(
        long id,
        UUID publicId,
        String loginId,
        String email,
        Map<String, String> name,
        String passwordHash,
        boolean deleted
) {

    public AuthUser {
        name = name == null ? Map.of() : Map.copyOf(name);
        passwordHash = passwordHash == null ? "" : passwordHash;
    }

    public boolean hasPassword() {
        return !passwordHash.isEmpty();
    }
}
