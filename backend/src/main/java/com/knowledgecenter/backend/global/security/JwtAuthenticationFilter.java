package com.knowledgecenter.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.knowledgecenter.backend.modules.auth.application.AccessTokenClaims;
import com.knowledgecenter.backend.modules.auth.application.InvalidTokenException;
import com.knowledgecenter.backend.modules.auth.application.TokenAuthority;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the bearer token's principal to the security context. The filter never rejects a
 * request itself: it records the failure and lets the authorization rules decide whether the
 * route needed an authenticated user.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    private static final String BEARER_SCHEME = "Bearer";

    private final TokenAuthority tokenAuthority;

    public JwtAuthenticationFilter(TokenAuthority tokenAuthority) {
        this.tokenAuthority = tokenAuthority;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization == null || authorization.isEmpty()) {
            request.setAttribute(AuthenticationFailure.REQUEST_ATTRIBUTE, AuthenticationFailure.MISSING_HEADER);
            filterChain.doFilter(request, response);
            return;
        }

        String[] parts = authorization.split(" ", 2);
        if (parts.length != 2 || !parts[0].equalsIgnoreCase(BEARER_SCHEME)) {
            request.setAttribute(AuthenticationFailure.REQUEST_ATTRIBUTE, AuthenticationFailure.MALFORMED_HEADER);
            filterChain.doFilter(request, response);
            return;
        }

        try {
            AccessTokenClaims claims = tokenAuthority.validateAccessToken(parts[1]);
            AuthenticatedUser principal = AuthenticatedUser.from(claims);
            List<SimpleGrantedAuthority> authorities = principal.roles().stream()
                    .map(role -> new SimpleGrantedAuthority("ROLE_" + role))
                    .toList();

            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(principal, null, authorities);
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authentication);
        } catch (InvalidTokenException ex) {
            log.debug("Rejected access token for {} {}", request.getMethod(), request.getRequestURI());
            SecurityContextHolder.clearContext();
            request.setAttribute(AuthenticationFailure.REQUEST_ATTRIBUTE, AuthenticationFailure.INVALID_TOKEN);
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return "OPTIONS".equalsIgnoreCase(request.getMethod());
    }
}
