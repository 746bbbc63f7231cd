package com.knowledgecenter.backend.modules.rbac.application;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

import com.knowledgecenter.backend.modules.auth.domain.Roles;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Role checks for a request: the permission table for route rules, plus the any-of and
 * all-of checks behind {@code @RequireRoles} and {@code @RequireAllRoles}.
 */
@Component
public class RbacAuthorizer {

    private static final Logger log = LoggerFactory.getLogger(RbacAuthorizer.class);

    static final String AUTHENTICATION_REQUIRED = "Access denied: authentication required";
    static final String INSUFFICIENT_PERMISSIONS = "Access denied: insufficient permissions";
    static final String ACCESS_DENIED = "Access denied";
    static final String INSUFFICIENT_ROLES = "Insufficient permissions";
    static final String ROUTE_NOT_LISTED = "Access denied: route is not listed";

    private final PermissionTable permissionTable;
    private final boolean denyUnlistedRoutes;

    public RbacAuthorizer(
            PermissionTable permissionTable,
            @Value("${app.rbac.deny-unlisted-routes:false}") boolean denyUnlistedRoutes
    ) {
        this.permissionTable = permissionTable;
        this.denyUnlistedRoutes = denyUnlistedRoutes;
    }

    /**
     * {@code full_access} passes everything. Routes without a rule are admitted unless
     * {@code app.rbac.deny-unlisted-routes} is set.
     */
    public AccessDecision authorizeRoute(Collection<String> userRoles, String method, String routePattern) {
        if (userRoles.contains(Roles.FULL_ACCESS)) {
            log.debug("full_access bypass for {} {}", method, routePattern);
            return AccessDecision.grant();
        }

        Optional<Set<String>> requiredRoles = permissionTable.findRequiredRoles(method, routePattern);
        if (requiredRoles.isEmpty()) {
            return denyUnlistedRoutes ? AccessDecision.deny(ROUTE_NOT_LISTED) : AccessDecision.grant();
        }
        if (userRoles.isEmpty()) {
            return AccessDecision.deny(AUTHENTICATION_REQUIRED);
        }
        boolean overlaps = requiredRoles.get().stream().anyMatch(userRoles::contains);
        return overlaps ? AccessDecision.grant() : AccessDecision.deny(INSUFFICIENT_PERMISSIONS);
    }

    public AccessDecision requireAny(Collection<String> userRoles, Collection<String> roles) {
        if (userRoles.isEmpty()) {
            return AccessDecision.deny(ACCESS_DENIED);
        }
        return roles.stream().anyMatch(userRoles::contains)
                ? AccessDecision.grant()
                : AccessDecision.deny(INSUFFICIENT_ROLES);
    }

    public AccessDecision requireAll(Collection<String> userRoles, Collection<String> roles) {
        if (userRoles.isEmpty()) {
            return AccessDecision.deny(ACCESS_DENIED);
        }
        return userRoles.containsAll(roles)
                ? AccessDecision.grant()
                : AccessDecision.deny(INSUFFICIENT_ROLES);
    }
}
