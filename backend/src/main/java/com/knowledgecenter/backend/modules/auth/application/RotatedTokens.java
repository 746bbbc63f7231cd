package com.knowledgecenter.backend.modules.auth.application;

import com.knowledgecenter.backend.modules.auth.presentation.dto.TokenResponse;

public record RotatedTokens(TokenResponse tokens, String refreshSecret) {
}
