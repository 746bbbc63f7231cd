package com.knowledgecenter.backend.modules.rbac.presentation;

import java.lang.annotation.Annotation;
import java.util.Arrays;
import java.util.List;

import com.knowledgecenter.backend.global.error.ProblemException;
import com.knowledgecenter.backend.global.security.AuthenticatedUser;
import com.knowledgecenter.backend.global.security.RequireAllRoles;
import com.knowledgecenter.backend.global.security.RequireRoles;
import com.knowledgecenter.backend.global.security.SecurityUtils;
import com.knowledgecenter.backend.modules.rbac.application.AccessDecision;
import com.knowledgecenter.backend.modules.rbac.application.RbacAuthorizer;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Authorizes a request against the handler's role annotations and the permission table.
 * Runs after handler mapping, so rules are keyed by the registered route pattern
 * ({@code /users/{userId}/roles}) rather than the concrete path.
 */
@Component
public class RbacAuthorizationInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RbacAuthorizationInterceptor.class);

    private final RbacAuthorizer authorizer;

    public RbacAuthorizationInterceptor(RbacAuthorizer authorizer) {
        this.authorizer = authorizer;
    }

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request,
                             @NonNull HttpServletResponse response,
                             @NonNull Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }
        List<String> roles = SecurityUtils.findCurrentUser()
                .map(AuthenticatedUser::roles)
                .orElse(List.of());

        RequireRoles anyOf = findAnnotation(handlerMethod, RequireRoles.class);
        if (anyOf != null) {
            enforce(authorizer.requireAny(roles, Arrays.asList(anyOf.value())), request);
        }
        RequireAllRoles allOf = findAnnotation(handlerMethod, RequireAllRoles.class);
        if (allOf != null) {
            enforce(authorizer.requireAll(roles, Arrays.asList(allOf.value())), request);
        }

        enforce(authorizer.authorizeRoute(roles, request.getMethod(), resolveRoutePattern(request)), request);
        return true;
    }

    static String resolveRoutePattern(HttpServletRequest request) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        if (pattern instanceof String routePattern && !routePattern.isEmpty()) {
            return routePattern;
        }
        return request.getServletPath();
    }

    private static void enforce(AccessDecision decision, HttpServletRequest request) {
        if (!decision.granted()) {
            log.info("Denied {} {}: {}", request.getMethod(), request.getRequestURI(), decision.reason());
            throw new ProblemException(HttpStatus.FORBIDDEN, "forbidden", decision.reason());
        }
    }

    private static <A extends Annotation> A findAnnotation(HandlerMethod handlerMethod,
                                                           Class<A> type) {
        A onMethod = AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getMethod(), type);
        return onMethod != null ? onMethod : AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getBeanType(), type);
    }
}
