package com.knowledgecenter.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Groups plus the group_users and group_roles join tables, which have no entities of their own.
 */
public interface GroupRepository extends JpaRepository<GroupEntity, Long> {

    Optional<GroupEntity> findByPublicId(String publicId);

    @Modifying(flushAutomatically = true)
    @Query(value = """
            INSERT INTO group_users (group_id, user_id, assigned_by, assigned_at)
            VALUES (:groupId, :userId, CAST(:assignedBy AS BIGINT), CURRENT_TIMESTAMP)
            ON CONFLICT (group_id, user_id) DO NOTHING
            """, nativeQuery = true)
    int insertMember(@Param("groupId") Long groupId,
                     @Param("userId") Long userId,
                     @Param("assignedBy") Long assignedBy);

    @Modifying(flushAutomatically = true)
    @Query(value = "DELETE FROM group_users WHERE group_id = :groupId AND user_id = :userId", nativeQuery = true)
    int deleteMember(@Param("groupId") Long groupId, @Param("userId") Long userId);

    @Modifying(flushAutomatically = true)
    @Query(value = "DELETE FROM group_users WHERE group_id = :groupId", nativeQuery = true)
    int deleteAllMembers(@Param("groupId") Long groupId);

    @Query(value = """
            SELECT u.public_id
            FROM users u
            JOIN group_users gu ON gu.user_id = u.id
            WHERE gu.group_id = :groupId
              AND u.is_deleted = false
            ORDER BY gu.assigned_at, u.id
            """, nativeQuery = true)
    List<UUID> findMemberPublicIds(@Param("groupId") Long groupId);

    @Query(value = """
            SELECT g.*
            FROM groups g
            JOIN group_users gu ON gu.group_id = g.id
            WHERE gu.user_id = :userId
            ORDER BY g.id
            """, nativeQuery = true)
    List<GroupEntity> findGroupsOfUser(@Param("userId") Long userId);

    @Query(value = """
            SELECT r.name
            FROM roles r
            JOIN group_roles gr ON gr.role_id = r.id
            WHERE gr.group_id = :groupId
            ORDER BY r.name
            """, nativeQuery = true)
    List<String> findRoleNames(@Param("groupId") Long groupId);

    @Modifying(flushAutomatically = true)
    @Query(value = """
            INSERT INTO group_roles (group_id, role_id)
            VALUES (:groupId, :roleId)
            ON CONFLICT (group_id, role_id) DO NOTHING
            """, nativeQuery = true)
    int insertRole(@Param("groupId") Long groupId, @Param("roleId") Long roleId);

    @Modifying(flushAutomatically = true)
    @Query(value = "DELETE FROM group_roles WHERE group_id = :groupId AND role_id = :roleId", nativeQuery = true)
    int deleteRole(@Param("groupId") Long groupId, @Param("roleId") Long roleId);

    @Modifying(flushAutomatically = true)
    @Query(value = "DELETE FROM group_roles WHERE group_id = :groupId", nativeQuery = true)
    int deleteAllRoles(@Param("groupId") Long groupId);
}
