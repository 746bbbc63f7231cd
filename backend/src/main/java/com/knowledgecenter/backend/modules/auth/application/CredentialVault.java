package com.knowledgecenter.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Password hashing and the random material behind refresh tokens and token ids.
 *
 * <p>Hashes are Argon2id in PHC string form
 * ({@code $argon2id$v=19$m=65536,t=1,p=4$<salt>$<hash>}). Verification re-derives the hash
 * with the parameters parsed from the stored string, so hashes created with older
 * parameters keep verifying after the defaults change.
 *
 * <p>Argon2id work is memory hard; a semaphore caps how many hashes run at once so a burst
 * of logins cannot occupy every request thread.
 */
@Component
public class CredentialVault {

    private static final Logger log = LoggerFactory.getLogger(CredentialVault.class);

    static final int SALT_LENGTH = 16;
    static final int HASH_LENGTH = 32;
    static final int PARALLELISM = 4;
    static final int MEMORY_KIB = 64 * 1024;
    static final int ITERATIONS = 1;

    private static final int REFRESH_SECRET_BYTES = 32;
    private static final int TOKEN_ID_BYTES = 16;

    private final PasswordEncoder passwordEncoder;
    private final Semaphore hashingPermits;
    private final SecureRandom secureRandom = new SecureRandom();

    public CredentialVault(
            PasswordEncoder passwordEncoder,
            @Value("${app.security.password-hashing.max-concurrent:0}") int maxConcurrentHashes
    ) {
        this.passwordEncoder = passwordEncoder;
        int permits = maxConcurrentHashes > 0 ? maxConcurrentHashes : Runtime.getRuntime().availableProcessors();
        this.hashingPermits = new Semaphore(permits, true);
    }

    /**
     * Argon2id encoder with the parameters new hashes are created with.
     */
    public static PasswordEncoder argon2idEncoder() {
        return new Argon2PasswordEncoder(SALT_LENGTH, HASH_LENGTH, PARALLELISM, MEMORY_KIB, ITERATIONS);
    }

    public String hashPassword(String password) {
        return withHashingPermit(() -> passwordEncoder.encode(password));
    }

    /**
     * Returns false for a wrong password and for any stored hash that cannot be parsed.
     */
    public boolean verifyPassword(String password, String encodedHash) {
        if (encodedHash == null || encodedHash.isBlank()) {
            return false;
        }
        return withHashingPermit(() -> {
            try {
                return passwordEncoder.matches(password, encodedHash);
            } catch (IllegalArgumentException ex) {
                log.warn("Stored password hash could not be parsed");
                return false;
            }
        });
    }

    /**
     * 256-bit refresh token secret, URL-safe base64 with padding.
     */
    public String generateRefreshSecret() {
        byte[] bytes = new byte[REFRESH_SECRET_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().encodeToString(bytes);
    }

    /**
     * 128-bit access token id, lowercase hex.
     */
    public String generateTokenId() {
        byte[] bytes = new byte[TOKEN_ID_BYTES];
        secureRandom.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    /**
     * SHA-256 of the secret as lowercase hex; the only form a refresh secret is stored in.
     */
    public String digest(String secret) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha256.digest(secret.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private <T> T withHashingPermit(Supplier<T> work) {
        try {
            hashingPermits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a password hashing slot", e);
        }
        try {
            return work.get();
        } finally {
            hashingPermits.release();
        }
    }
}
