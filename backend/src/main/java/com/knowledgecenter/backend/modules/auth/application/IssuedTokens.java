package com.knowledgecenter.backend.modules.auth.application;

import com.knowledgecenter.backend.modules.auth.domain.RefreshTokenRecord;

/**
 * An access token together with the refresh secret issued beside it. The secret is handed to
 * the client once and never persisted.
 */
public record IssuedTokens(
        String accessToken,
        long expiresInSeconds,
        String refreshSecret,
        RefreshTokenRecord refreshToken
) {
}
