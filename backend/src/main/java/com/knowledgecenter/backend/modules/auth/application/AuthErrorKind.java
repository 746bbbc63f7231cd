package com.knowledgecenter.backend.modules.auth.application;

/**
 * Failure kinds of the session flows. The HTTP layer maps each kind to a status.
 */
public enum AuthErrorKind {

    INVALID_EMAIL("Invalid email format"),
    INVALID_NAME("Name must have at least one locale value"),
    INVALID_PASSWORD("Password must be at least 8 characters"),
    EMAIL_EXISTS("Email already exists"),
    LOGIN_ID_EXISTS("Login ID already exists"),
    INVALID_CREDENTIALS("Invalid credentials"),
    INVALID_TOKEN("Invalid refresh token"),
    TOKEN_REVOKED("Token has been revoked. Please login again."),
    TOKEN_EXPIRED("Refresh token has expired. Please login again."),
    PUBLIC_GROUP_NOT_FOUND("System configuration error"),
    USER_NOT_FOUND("User not found");

    private final String message;

    AuthErrorKind(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }

    /**
     * Refresh failures that must also clear the refresh cookie.
     */
    public boolean isRefreshTokenRejection() {
        return this == INVALID_TOKEN || this == TOKEN_REVOKED || this == TOKEN_EXPIRED;
    }
}
