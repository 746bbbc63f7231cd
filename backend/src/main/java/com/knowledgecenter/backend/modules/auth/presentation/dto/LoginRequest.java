package com.knowledgecenter.backend.modules.auth.presentation.dto;

/**
 * {@code loginId} may hold either the login id or the email address. Blank values simply
 * fail as invalid credentials.
 */
public record LoginRequest(String loginId, String password) {
}
