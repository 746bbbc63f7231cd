package com.knowledgecenter.backend.global.security;

import java.util.Optional;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.server.ResponseStatusException;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Principal of the current request, empty for anonymous requests.
     */
    public static Optional<AuthenticatedUser> findCurrentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof AuthenticatedUser principal) {
            return Optional.of(principal);
        }
        return Optional.empty();
    }

    public static AuthenticatedUser getCurrentUser() {
        return findCurrentUser()
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "User not authenticated"));
    }

    public static String getCurrentUserId() {
        return getCurrentUser().userId();
    }
}
