package com.knowledgecenter.backend.modules.rbac.application;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.knowledgecenter.backend.modules.rbac.domain.PermissionRule;

import org.springframework.stereotype.Component;

/**
 * In-memory map of method → route pattern → required roles.
 *
 * <p>{@link #load} builds the replacement map without holding the lock and swaps it in under
 * the write lock, so a reader sees either the whole old table or the whole new one.
 */
@Component
public class PermissionTable {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private Map<String, Map<String, Set<String>>> permissions = Map.of();

    public void load(List<PermissionRule> rules) {
        Map<String, Map<String, Set<String>>> building = new HashMap<>();
        for (PermissionRule rule : rules) {
            building.computeIfAbsent(normalizeMethod(rule.method()), ignored -> new HashMap<>())
                    .put(rule.pathPattern(), Set.copyOf(rule.requiredRoles()));
        }
        Map<String, Map<String, Set<String>>> replacement = new HashMap<>();
        building.forEach((method, patterns) -> replacement.put(method, Map.copyOf(patterns)));

        lock.writeLock().lock();
        try {
            permissions = Collections.unmodifiableMap(replacement);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Roles required for the route: exact method first, then the {@code "*"} wildcard.
     * Empty when no rule covers the route.
     */
    public Optional<Set<String>> findRequiredRoles(String method, String pathPattern) {
        lock.readLock().lock();
        try {
            Set<String> roles = lookup(permissions, normalizeMethod(method), pathPattern);
            if (roles == null) {
                roles = lookup(permissions, PermissionRule.ANY_METHOD, pathPattern);
            }
            return Optional.ofNullable(roles);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * The current table. Immutable; later reloads do not change a snapshot already taken.
     */
    public Map<String, Map<String, Set<String>>> snapshot() {
        lock.readLock().lock();
        try {
            return permissions;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        return snapshot().values().stream().mapToInt(Map::size).sum();
    }

    private static Set<String> lookup(Map<String, Map<String, Set<String>>> table, String method, String pathPattern) {
        Map<String, Set<String>> byPattern = table.get(method);
        return byPattern == null ? null : byPattern.get(pathPattern);
    }

    private static String normalizeMethod(String method) {
        return method == null ? "" : method.trim().toUpperCase(Locale.ROOT);
    }
}
