package com.knowledgecenter.backend.modules.auth.infrastructure.persistence;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.knowledgecenter.backend.modules.auth.application.IdentityStore;
import com.knowledgecenter.backend.modules.auth.domain.AuthUser;
import com.knowledgecenter.backend.modules.auth.domain.NewRefreshToken;
import com.knowledgecenter.backend.modules.auth.domain.NewUser;
import com.knowledgecenter.backend.modules.auth.domain.RefreshTokenRecord;
import com.knowledgecenter.backend.modules.auth.domain.UserGroup;
import com.knowledgecenter.backend.modules.rbac.domain.PermissionRule;
import com.knowledgecenter.backend.modules.rbac.infrastructure.ApiPermissionEntity;
import com.knowledgecenter.backend.modules.rbac.infrastructure.ApiPermissionRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link IdentityStore} backed by PostgreSQL through Spring Data JPA.
 */
@Component
@Transactional
public class JpaIdentityStore implements IdentityStore {

    private final UserRepository userRepository;
    private final UserTokenRepository userTokenRepository;
    private final GroupRepository groupRepository;
    private final RoleRepository roleRepository;
    private final ApiPermissionRepository apiPermissionRepository;
    private final Clock clock;

    public JpaIdentityStore(
            UserRepository userRepository,
            UserTokenRepository userTokenRepository,
            GroupRepository groupRepository,
            RoleRepository roleRepository,
            ApiPermissionRepository apiPermissionRepository,
            Clock clock
    ) {
        this.userRepository = userRepository;
        this.userTokenRepository = userTokenRepository;
        this.groupRepository = groupRepository;
        this.roleRepository = roleRepository;
        this.apiPermissionRepository = apiPermissionRepository;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AuthUser> findUserByLoginId(String loginId) {
        return userRepository.findByLoginIdAndDeletedFalse(loginId).map(JpaIdentityStore::toAuthUser);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AuthUser> findUserByEmail(String email) {
        return userRepository.findByEmailAndDeletedFalse(email).map(JpaIdentityStore::toAuthUser);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AuthUser> findUserById(long userId) {
        return userRepository.findByIdAndDeletedFalse(userId).map(JpaIdentityStore::toAuthUser);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AuthUser> findUserByPublicId(UUID publicId) {
        return userRepository.findByPublicIdAndDeletedFalse(publicId).map(JpaIdentityStore::toAuthUser);
    }

    @Override
    public AuthUser createUser(NewUser user) {
        UserEntity entity = new UserEntity();
        entity.setPublicId(UUID.randomUUID());
        entity.setLoginId(user.loginId());
        entity.setEmail(user.email());
        entity.setName(new HashMap<>(user.name()));
        entity.setPasswordHash(user.passwordHash());
        entity.setVisible(true);
        entity.setDeleted(false);
        return toAuthUser(userRepository.saveAndFlush(entity));
    }

    @Override
    public RefreshTokenRecord createToken(NewRefreshToken token) {
        UserTokenEntity entity = new UserTokenEntity();
        entity.setUser(userRepository.getReferenceById(token.userId()));
        entity.setTokenHash(token.tokenHash());
        entity.setExpiresAt(token.expiresAt());
        entity.setRevoked(false);
        entity.setParentTokenId(token.parentId());
        entity.setClientIp(token.clientIp());
        entity.setUserAgent(token.userAgent());
        return toRecord(userTokenRepository.saveAndFlush(entity));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RefreshTokenRecord> findTokenByHash(String tokenHash) {
        return userTokenRepository.findFirstByTokenHashOrderByIdDesc(tokenHash).map(JpaIdentityStore::toRecord);
    }

    @Override
    public void revokeToken(long tokenId) {
        userTokenRepository.revokeById(tokenId, now());
    }

    /**
     * Runs in its own transaction so reuse-detection revocation commits even though the
     * surrounding refresh request fails.
     */
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int revokeAllUserTokens(long userId) {
        return userTokenRepository.revokeAllActiveByUserId(userId, now());
    }

    @Override
    public void markTokenReplaced(long oldTokenId, long newTokenId) {
        userTokenRepository.markReplaced(oldTokenId, newTokenId, now());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserGroup> findGroupByPublicId(String publicId) {
        return groupRepository.findByPublicId(publicId).map(JpaIdentityStore::toUserGroup);
    }

    @Override
    public void addUserToGroup(long userId, long groupId, Long assignedBy) {
        groupRepository.insertMember(groupId, userId, assignedBy);
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findEffectiveRoles(long userId) {
        return roleRepository.findEffectiveRoleNames(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PermissionRule> findAllPermissionRules() {
        return apiPermissionRepository.findAllByOrderByIdAsc().stream()
                .map(JpaIdentityStore::toPermissionRule)
                .toList();
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    static AuthUser toAuthUser(UserEntity entity) {
        return new AuthUser(
                entity.getId(),
                entity.getPublicId(),
                entity.getLoginId(),
                entity.getEmail(),
                entity.getName(),
                entity.getPasswordHash(),
                entity.isDeleted()
        );
    }

    public static UserGroup toUserGroup(GroupEntity entity) {
        return new UserGroup(entity.getId(), entity.getPublicId(), entity.getName(), entity.getDescription());
    }

    private static RefreshTokenRecord toRecord(UserTokenEntity entity) {
        return new RefreshTokenRecord(
                entity.getId(),
                entity.getUser().getId(),
                entity.getTokenHash(),
                entity.getExpiresAt(),
                entity.isRevoked(),
                entity.getReplacedByTokenId(),
                entity.getParentTokenId(),
                entity.getClientIp(),
                entity.getUserAgent(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }

    private static PermissionRule toPermissionRule(ApiPermissionEntity entity) {
        return new PermissionRule(entity.getId(), entity.getMethod(), entity.getPathPattern(),
                entity.getRequiredRoles());
    }
}
