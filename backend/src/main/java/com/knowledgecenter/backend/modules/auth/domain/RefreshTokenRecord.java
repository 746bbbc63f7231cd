package com.knowledgecenter.backend.modules.auth.domain;

import java.time.OffsetDateTime;

/**
 * Persisted half of a refresh token. Only the SHA-256 digest of the secret is stored.
 */
public record RefreshTokenRecord(
        long id,
        long userId,
        String tokenHash,
        OffsetDateTime expiresAt,
        boolean revoked,
        Long replacedById,
        Long parentId,
        String clientIp,
        String userAgent,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public boolean isExpiredAt(OffsetDateTime now) {
        return now.isAfter(expiresAt);
    }
}
