package com.knowledgecenter.backend.modules.auth.application;

/**
 * Access token rejected. Deliberately carries no detail about why.
 */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
