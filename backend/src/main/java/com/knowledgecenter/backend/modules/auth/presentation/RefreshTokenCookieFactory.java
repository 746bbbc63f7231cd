package com.knowledgecenter.backend.modules.auth.presentation;

import java.time.Duration;

import com.knowledgecenter.backend.modules.auth.application.TokenAuthority;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * Builds the HttpOnly cookie that carries the refresh secret. It is scoped to the auth routes
 * and marked Secure everywhere except the local environment.
 */
@Component
public class RefreshTokenCookieFactory {

    public static final String COOKIE_NAME = "refresh_token";

    static final String LOCAL_ENV = "local";

    private final String cookiePath;
    private final boolean secure;

    public RefreshTokenCookieFactory(
            @Value("${server.servlet.context-path:}") String contextPath,
            @Value("${app.env:local}") String appEnv
    ) {
        String prefix = contextPath == null || contextPath.equals("/") ? "" : contextPath;
        this.cookiePath = prefix + "/auth";
        this.secure = !LOCAL_ENV.equals(appEnv);
    }

    public ResponseCookie issue(String refreshSecret) {
        return base(refreshSecret)
                .maxAge(TokenAuthority.REFRESH_TOKEN_TTL)
                .build();
    }

    /**
     * Empty cookie that makes the browser drop the stored one.
     */
    public ResponseCookie clear() {
        return base("")
                .maxAge(Duration.ZERO)
                .build();
    }

    private ResponseCookie.ResponseCookieBuilder base(String value) {
        return ResponseCookie.from(COOKIE_NAME, value)
                .path(cookiePath)
                .httpOnly(true)
                .secure(secure)
                .sameSite("Strict");
    }
}
