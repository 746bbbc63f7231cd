package com.knowledgecenter.backend.modules.auth.presentation.dto;

public record RegisterResponse(UserInfoResponse user, TokenResponse tokens, String message) {
}
