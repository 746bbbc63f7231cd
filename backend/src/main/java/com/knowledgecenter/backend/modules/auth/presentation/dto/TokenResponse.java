package com.knowledgecenter.backend.modules.auth.presentation.dto;

public record TokenResponse(String accessToken, String tokenType, long expiresIn) {
}
