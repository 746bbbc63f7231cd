package com.knowledgecenter.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Process-wide HMAC key for access tokens, built from the UTF-8 bytes of {@code jwt.secret}.
 */
@Component
public class JwtTokenProvider {

    public static final int MIN_SECRET_BYTES = 32;

    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret:}") String secretString) {
        if (secretString == null || secretString.isBlank()) {
            throw new IllegalStateException("jwt.secret (JWT_SECRET) must be configured");
        }
        byte[] keyBytes = secretString.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }
        this.secretKey = new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }
}
