package com.knowledgecenter.backend.support;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import com.knowledgecenter.backend.modules.auth.application.IdentityStore;
import com.knowledgecenter.backend.modules.auth.domain.AuthUser;
import com.knowledgecenter.backend.modules.auth.domain.NewRefreshToken;
import com.knowledgecenter.backend.modules.auth.domain.NewUser;
import com.knowledgecenter.backend.modules.auth.domain.RefreshTokenRecord;
import com.knowledgecenter.backend.modules.auth.domain.UserGroup;
import com.knowledgecenter.backend.modules.rbac.domain.PermissionRule;

import org.springframework.dao.DuplicateKeyException;

/**
 * {@link IdentityStore} kept in maps, with helpers to arrange groups, roles and rules.
 * Methods are synchronized; tests may drive it from several threads.
 */
public class InMemoryIdentityStore implements IdentityStore {

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    private final Map<Long, AuthUser> users = new LinkedHashMap<>();
    private final Map<Long, RefreshTokenRecord> tokens = new LinkedHashMap<>();
    private final Map<Long, UserGroup> groups = new LinkedHashMap<>();
    private final Map<Long, Set<Long>> groupMembers = new HashMap<>();
    private final Map<Long, Set<String>> groupRoles = new HashMap<>();
    private final Map<Long, Set<String>> userRoles = new HashMap<>();
    private final List<PermissionRule> rules = new ArrayList<>();

    public InMemoryIdentityStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Store seeded like the database: a {@code public} group granting {@code user}.
     */
    public static InMemoryIdentityStore withPublicGroup(Clock clock) {
        InMemoryIdentityStore store = new InMemoryIdentityStore(clock);
        UserGroup publicGroup = store.addGroup(UserGroup.PUBLIC_GROUP_ID);
        store.grantGroupRole(publicGroup.id(), "user");
        return store;
    }

    /**
     * Drops everything and re-seeds the {@code public} group, for stores shared by a cached
     * Spring context.
     */
    public synchronized void reset() {
        users.clear();
        tokens.clear();
        groups.clear();
        groupMembers.clear();
        groupRoles.clear();
        userRoles.clear();
        rules.clear();
        UserGroup publicGroup = addGroup(UserGroup.PUBLIC_GROUP_ID);
        grantGroupRole(publicGroup.id(), "user");
    }

    public synchronized UserGroup addGroup(String publicId) {
        long id = sequence.incrementAndGet();
        UserGroup group = new UserGroup(id, publicId, Map.of("en-US", publicId), null);
        groups.put(id, group);
        return group;
    }

    public synchronized void grantGroupRole(long groupId, String role) {
        groupRoles.computeIfAbsent(groupId, ignored -> new HashSet<>()).add(role);
    }

    public synchronized void grantUserRole(long userId, String role) {
        userRoles.computeIfAbsent(userId, ignored -> new HashSet<>()).add(role);
    }

    public synchronized void addPermissionRule(String method, String pathPattern, String... roles) {
        rules.add(new PermissionRule(sequence.incrementAndGet(), method, pathPattern, List.of(roles)));
    }

    public synchronized void markDeleted(long userId) {
        AuthUser user = users.get(userId);
        users.put(userId, new AuthUser(user.id(), user.publicId(), user.loginId(), user.email(), user.name(),
                user.passwordHash(), true));
    }

    public synchronized List<RefreshTokenRecord> tokensOf(long userId) {
        return tokens.values().stream()
                .filter(token -> token.userId() == userId)
                .sorted(Comparator.comparingLong(RefreshTokenRecord::id))
                .toList();
    }

    public synchronized RefreshTokenRecord token(long tokenId) {
        return tokens.get(tokenId);
    }

    public synchronized Set<Long> membersOf(long groupId) {
        return Set.copyOf(groupMembers.getOrDefault(groupId, Set.of()));
    }

    @Override
    public synchronized Optional<AuthUser> findUserByLoginId(String loginId) {
        return visibleUsers().filter(user -> user.loginId().equals(loginId)).findFirst();
    }

    @Override
    public synchronized Optional<AuthUser> findUserByEmail(String email) {
        return visibleUsers().filter(user -> user.email().equals(email)).findFirst();
    }

    @Override
    public synchronized Optional<AuthUser> findUserById(long userId) {
        return visibleUsers().filter(user -> user.id() == userId).findFirst();
    }

    @Override
    public synchronized Optional<AuthUser> findUserByPublicId(UUID publicId) {
        return visibleUsers().filter(user -> user.publicId().equals(publicId)).findFirst();
    }

    @Override
    public synchronized AuthUser createUser(NewUser user) {
        boolean duplicate = users.values().stream()
                .anyMatch(existing -> existing.loginId().equals(user.loginId()) || existing.email().equals(user.email()));
        if (duplicate) {
            throw new DuplicateKeyException("users login_id/email already taken");
        }
        long id = sequence.incrementAndGet();
        AuthUser created = new AuthUser(id, UUID.randomUUID(), user.loginId(), user.email(), user.name(),
                user.passwordHash(), false);
        users.put(id, created);
        return created;
    }

    @Override
    public synchronized RefreshTokenRecord createToken(NewRefreshToken token) {
        boolean duplicate = tokens.values().stream()
                .anyMatch(existing -> existing.userId() == token.userId() && existing.tokenHash().equals(token.tokenHash()));
        if (duplicate) {
            throw new DuplicateKeyException("user_tokens (user_id, token_hash) already exists");
        }
        long id = sequence.incrementAndGet();
        OffsetDateTime now = now();
        RefreshTokenRecord stored = new RefreshTokenRecord(id, token.userId(), token.tokenHash(), token.expiresAt(),
                false, null, token.parentId(), token.clientIp(), token.userAgent(), now, now);
        tokens.put(id, stored);
        return stored;
    }

    @Override
    public synchronized Optional<RefreshTokenRecord> findTokenByHash(String tokenHash) {
        return tokens.values().stream()
                .filter(token -> token.tokenHash().equals(tokenHash))
                .max(Comparator.comparingLong(RefreshTokenRecord::id));
    }

    @Override
    public synchronized void revokeToken(long tokenId) {
        RefreshTokenRecord token = tokens.get(tokenId);
        if (token != null) {
            tokens.put(tokenId, revoked(token, token.replacedById()));
        }
    }

    @Override
    public synchronized int revokeAllUserTokens(long userId) {
        int count = 0;
        for (RefreshTokenRecord token : new ArrayList<>(tokens.values())) {
            if (token.userId() == userId && !token.revoked()) {
                tokens.put(token.id(), revoked(token, token.replacedById()));
                count++;
            }
        }
        return count;
    }

    @Override
    public synchronized void markTokenReplaced(long oldTokenId, long newTokenId) {
        RefreshTokenRecord token = tokens.get(oldTokenId);
        if (token != null) {
            tokens.put(oldTokenId, revoked(token, newTokenId));
        }
    }

    @Override
    public synchronized Optional<UserGroup> findGroupByPublicId(String publicId) {
        return groups.values().stream().filter(group -> group.publicId().equals(publicId)).findFirst();
    }

    @Override
    public synchronized void addUserToGroup(long userId, long groupId, Long assignedBy) {
        groupMembers.computeIfAbsent(groupId, ignored -> new HashSet<>()).add(userId);
    }

    @Override
    public synchronized List<String> findEffectiveRoles(long userId) {
        Set<String> roles = new TreeSet<>(userRoles.getOrDefault(userId, Set.of()));
        groupMembers.forEach((groupId, members) -> {
            if (members.contains(userId)) {
                roles.addAll(groupRoles.getOrDefault(groupId, Set.of()));
            }
        });
        return List.copyOf(roles);
    }

    @Override
    public synchronized List<PermissionRule> findAllPermissionRules() {
        return List.copyOf(rules);
    }

    private java.util.stream.Stream<AuthUser> visibleUsers() {
        return users.values().stream().filter(user -> !user.deleted());
    }

    private RefreshTokenRecord revoked(RefreshTokenRecord token, Long replacedById) {
        return new RefreshTokenRecord(token.id(), token.userId(), token.tokenHash(), token.expiresAt(), true,
                replacedById, token.parentId(), token.clientIp(), token.userAgent(), token.createdAt(), now());
    }

    private OffsetDateTime now() {
        return OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}
