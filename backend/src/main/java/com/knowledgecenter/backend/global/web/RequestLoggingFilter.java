package com.knowledgecenter.backend.global.web;

import java.io.IOException;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * One access log line per request: INFO for success, WARN for 4xx, ERROR for 5xx.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RequestLoggingFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        long startedAt = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            long elapsedMillis = (System.nanoTime() - startedAt) / 1_000_000L;
            logRequest(request, response.getStatus(), elapsedMillis);
        }
    }

    private static void logRequest(HttpServletRequest request, int status, long elapsedMillis) {
        String method = request.getMethod();
        String path = request.getRequestURI();
        if (status >= 500) {
            log.error("{} {} -> {} ({} ms) remote_addr={} user_agent={}", method, path, status, elapsedMillis,
                    request.getRemoteAddr(), request.getHeader(HttpHeaders.USER_AGENT));
        } else if (status >= 400) {
            log.warn("{} {} -> {} ({} ms) remote_addr={} user_agent={}", method, path, status, elapsedMillis,
                    request.getRemoteAddr(), request.getHeader(HttpHeaders.USER_AGENT));
        } else {
            log.info("{} {} -> {} ({} ms)", method, path, status, elapsedMillis);
        }
    }

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return true;
    }
}
