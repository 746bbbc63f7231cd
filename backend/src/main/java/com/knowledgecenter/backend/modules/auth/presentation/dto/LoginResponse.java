package com.knowledgecenter.backend.modules.auth.presentation.dto;

public record LoginResponse(UserInfoResponse user, TokenResponse tokens) {
}
