package com.knowledgecenter.backend.modules.auth.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Roles plus the user_roles join table.
 */
public interface RoleRepository extends JpaRepository<RoleEntity, Long> {

    Optional<RoleEntity> findByName(String name);

    List<RoleEntity> findByNameIn(Collection<String> names);

    @Query(value = """
            SELECT DISTINCT r.name
            FROM roles r
            WHERE r.id IN (
                SELECT ur.role_id FROM user_roles ur WHERE ur.user_id = :userId
                UNION
                SELECT gr.role_id
                FROM group_roles gr
                JOIN group_users gu ON gu.group_id = gr.group_id
                WHERE gu.user_id = :userId
            )
            ORDER BY r.name
            """, nativeQuery = true)
    List<String> findEffectiveRoleNames(@Param("userId") Long userId);

    @Query(value = """
            SELECT r.name
            FROM roles r
            JOIN user_roles ur ON ur.role_id = r.id
            WHERE ur.user_id = :userId
            ORDER BY r.name
            """, nativeQuery = true)
    List<String> findDirectRoleNames(@Param("userId") Long userId);

    @Modifying(flushAutomatically = true)
    @Query(value = """
            INSERT INTO user_roles (user_id, role_id)
            VALUES (:userId, :roleId)
            ON CONFLICT (user_id, role_id) DO NOTHING
            """, nativeQuery = true)
    int insertUserRole(@Param("userId") Long userId, @Param("roleId") Long roleId);

    @Modifying(flushAutomatically = true)
    @Query(value = "DELETE FROM user_roles WHERE user_id = :userId AND role_id = :roleId", nativeQuery = true)
    int deleteUserRole(@Param("userId") Long userId, @Param("roleId") Long roleId);

    @Modifying(flushAutomatically = true)
    @Query(value = "DELETE FROM user_roles WHERE user_id = :userId", nativeQuery = true)
    int deleteAllUserRoles(@Param("userId") Long userId);
}
