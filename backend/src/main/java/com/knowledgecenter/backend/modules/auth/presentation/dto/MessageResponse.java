package com.knowledgecenter.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
