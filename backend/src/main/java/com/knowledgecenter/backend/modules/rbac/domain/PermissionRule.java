package com.knowledgecenter.backend.modules.rbac.domain;

import java.util.List;

/**
 * Roles required for one (method, route pattern). Method {@code "*"} matches any method.
 */
public record PermissionRule(long id, String method, String pathPattern, List<String> requiredRoles) {

    public static final String ANY_METHOD = "*";

    public PermissionRule {
        requiredRoles = requiredRoles == null ? List.of() : List.copyOf(requiredRoles);
    }
}
