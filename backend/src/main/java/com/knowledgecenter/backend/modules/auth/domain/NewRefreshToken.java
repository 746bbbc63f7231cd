package com.knowledgecenter.backend.modules.auth.domain;

import java.time.OffsetDateTime;

public record NewRefreshToken(
        long userId,
        String tokenHash,
        OffsetDateTime expiresAt,
        Long parentId,
        String clientIp,
        String userAgent
) {
}
