package com.knowledgecenter.backend.global.security;

/**
 * Why a request ended up unauthenticated. Recorded by {@link JwtAuthenticationFilter} and
 * reported by {@link RestAuthenticationEntryPoint} if the route turns out to need a user.
 */
public enum AuthenticationFailure {

    MISSING_HEADER("Authorization header required"),
    MALFORMED_HEADER("Invalid authorization header format"),
    INVALID_TOKEN("Invalid or expired token");

    public static final String REQUEST_ATTRIBUTE = AuthenticationFailure.class.getName();

    private final String message;

    AuthenticationFailure(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
