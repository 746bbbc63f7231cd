package com.knowledgecenter.backend.modules.auth.application;

public class AuthException extends RuntimeException {

    private final AuthErrorKind kind;

    public AuthException(AuthErrorKind kind) {
        super(kind.message());
        this.kind = kind;
    }

    public AuthErrorKind getKind() {
        return kind;
    }
}
