package com.knowledgecenter.backend.modules.auth.presentation;

import com.knowledgecenter.backend.global.error.ProblemResponse;
import com.knowledgecenter.backend.modules.auth.application.AuthErrorKind;
import com.knowledgecenter.backend.modules.auth.application.AuthException;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps session failures to HTTP statuses. Refresh token rejections also clear the cookie so
 * the client stops presenting a dead secret.
 */
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class AuthExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(AuthExceptionHandler.class);

    private final RefreshTokenCookieFactory cookieFactory;

    public AuthExceptionHandler(RefreshTokenCookieFactory cookieFactory) {
        this.cookieFactory = cookieFactory;
    }

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ProblemResponse> handleAuthException(AuthException ex, HttpServletRequest request) {
        AuthErrorKind kind = ex.getKind();
        HttpStatus status = statusOf(kind);
        if (status.is5xxServerError()) {
            log.error("Authentication flow failed: kind={} method={} path={} remote_addr={} user_agent={}",
                    kind, request.getMethod(), request.getRequestURI(), request.getRemoteAddr(),
                    request.getHeader(HttpHeaders.USER_AGENT));
        }

        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_PROBLEM_JSON);
        if (kind.isRefreshTokenRejection()) {
            builder.header(HttpHeaders.SET_COOKIE, cookieFactory.clear().toString());
        }
        return builder.body(ProblemResponse.of(status, kind.name().toLowerCase(), kind.message(),
                request.getRequestURI()));
    }

    static HttpStatus statusOf(AuthErrorKind kind) {
        return switch (kind) {
            case INVALID_EMAIL, INVALID_NAME, INVALID_PASSWORD -> HttpStatus.BAD_REQUEST;
            case EMAIL_EXISTS, LOGIN_ID_EXISTS -> HttpStatus.CONFLICT;
            case INVALID_CREDENTIALS, INVALID_TOKEN, TOKEN_REVOKED, TOKEN_EXPIRED -> HttpStatus.UNAUTHORIZED;
            case USER_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case PUBLIC_GROUP_NOT_FOUND -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
