package com.knowledgecenter.backend.modules.auth.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.knowledgecenter.backend.modules.auth.domain.AuthUser;
import com.knowledgecenter.backend.modules.auth.domain.NewRefreshToken;
import com.knowledgecenter.backend.modules.auth.domain.NewUser;
import com.knowledgecenter.backend.modules.auth.domain.RefreshTokenRecord;
import com.knowledgecenter.backend.modules.auth.domain.UserGroup;
import com.knowledgecenter.backend.modules.rbac.domain.PermissionRule;

/**
 * Persistence capabilities the authentication core depends on.
 *
 * <p>User lookups never return soft-deleted users. Failures surface as Spring's
 * {@link org.springframework.dao.DataAccessException} hierarchy.
 */
public interface IdentityStore {

    Optional<AuthUser> findUserByLoginId(String loginId);

    Optional<AuthUser> findUserByEmail(String email);

    Optional<AuthUser> findUserById(long userId);

    Optional<AuthUser> findUserByPublicId(UUID publicId);

    /**
     * Inserts a visible, non-deleted user and returns it with its assigned ids.
     */
    AuthUser createUser(NewUser user);

    /**
     * Stores a refresh token record and returns it as persisted, id included.
     */
    RefreshTokenRecord createToken(NewRefreshToken token);

    Optional<RefreshTokenRecord> findTokenByHash(String tokenHash);

    void revokeToken(long tokenId);

    /**
     * Revokes every non-revoked token of the user.
     *
     * @return number of records revoked
     */
    int revokeAllUserTokens(long userId);

    /**
     * Sets {@code replaced_by} on the old record and revokes it in a single write.
     */
    void markTokenReplaced(long oldTokenId, long newTokenId);

    Optional<UserGroup> findGroupByPublicId(String publicId);

    /**
     * Adds a membership; adding an existing membership is a no-op.
     */
    void addUserToGroup(long userId, long groupId, Long assignedBy);

    /**
     * Distinct union of direct and group-inherited role names, sorted by name.
     */
    List<String> findEffectiveRoles(long userId);

    /**
     * All permission rules ordered by id.
     */
    List<PermissionRule> findAllPermissionRules();
}
