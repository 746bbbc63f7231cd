package com.knowledgecenter.backend.modules.auth.application;

import com.knowledgecenter.backend.modules.auth.presentation.dto.TokenResponse;
import com.knowledgecenter.backend.modules.auth.presentation.dto.UserInfoResponse;

/**
 * Result of register and login. {@code refreshSecret} goes into the refresh cookie only.
 */
public record AuthenticatedSession(UserInfoResponse user, TokenResponse tokens, String refreshSecret) {
}
