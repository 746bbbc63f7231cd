package com.knowledgecenter.backend.modules.access.application;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import com.knowledgecenter.backend.global.error.ProblemException;
import com.knowledgecenter.backend.modules.auth.domain.UserGroup;
import com.knowledgecenter.backend.modules.auth.infrastructure.persistence.GroupEntity;
import com.knowledgecenter.backend.modules.auth.infrastructure.persistence.GroupRepository;
import com.knowledgecenter.backend.modules.auth.infrastructure.persistence.JpaIdentityStore;
import com.knowledgecenter.backend.modules.auth.infrastructure.persistence.RoleEntity;
import com.knowledgecenter.backend.modules.auth.infrastructure.persistence.RoleRepository;
import com.knowledgecenter.backend.modules.auth.infrastructure.persistence.UserEntity;
import com.knowledgecenter.backend.modules.auth.infrastructure.persistence.UserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Maintains direct user roles, group membership and group roles. Replacement operations swap
 * the whole set inside one transaction. Changes only show up in access tokens issued later.
 */
@Service
@Transactional
public class AccessAdminService {

    private static final Logger log = LoggerFactory.getLogger(AccessAdminService.class);

    private final UserRepository userRepository;
    private final GroupRepository groupRepository;
    private final RoleRepository roleRepository;

    public AccessAdminService(
            UserRepository userRepository,
            GroupRepository groupRepository,
            RoleRepository roleRepository
    ) {
        this.userRepository = userRepository;
        this.groupRepository = groupRepository;
        this.roleRepository = roleRepository;
    }

    @Transactional(readOnly = true)
    public List<String> getUserRoles(@NonNull String userPublicId) {
        UserEntity user = findUser(userPublicId);
        return roleRepository.findDirectRoleNames(user.getId());
    }

    public List<String> replaceUserRoles(@NonNull String userPublicId, @NonNull Collection<String> roleNames) {
        UserEntity user = findUser(userPublicId);
        List<RoleEntity> roles = findRoles(roleNames);

        roleRepository.deleteAllUserRoles(user.getId());
        roles.forEach(role -> roleRepository.insertUserRole(user.getId(), role.getId()));
        log.info("Replaced direct roles: user_id={} roles={}", userPublicId, roleNames);
        return roleRepository.findDirectRoleNames(user.getId());
    }

    public void removeUserRole(@NonNull String userPublicId, @NonNull String roleName) {
        UserEntity user = findUser(userPublicId);
        RoleEntity role = roleRepository.findByName(roleName)
                .orElseThrow(() -> roleNotFound(roleName));
        if (roleRepository.deleteUserRole(user.getId(), role.getId()) == 0) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "access.role_not_assigned",
                    "User does not have role: " + roleName);
        }
        log.info("Removed direct role: user_id={} role={}", userPublicId, roleName);
    }

    @Transactional(readOnly = true)
    public List<UserGroup> getUserGroups(@NonNull String userPublicId) {
        UserEntity user = findUser(userPublicId);
        return groupRepository.findGroupsOfUser(user.getId()).stream()
                .map(JpaIdentityStore::toUserGroup)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<UUID> getGroupMembers(@NonNull String groupPublicId) {
        GroupEntity group = findGroup(groupPublicId);
        return groupRepository.findMemberPublicIds(group.getId());
    }

    /**
     * @param actorPublicId public id of the administrator, recorded as {@code assigned_by}
     */
    public List<UUID> replaceGroupMembers(
            @NonNull String groupPublicId,
            @NonNull Collection<UUID> userPublicIds,
            String actorPublicId
    ) {
        GroupEntity group = findGroup(groupPublicId);
        Set<UUID> requested = new LinkedHashSet<>(userPublicIds);
        List<UserEntity> users = userRepository.findByPublicIdInAndDeletedFalse(requested);
        if (users.size() != requested.size()) {
            Set<UUID> found = users.stream().map(UserEntity::getPublicId).collect(Collectors.toSet());
            List<UUID> missing = requested.stream().filter(id -> !found.contains(id)).toList();
            throw new ProblemException(HttpStatus.NOT_FOUND, "access.user_not_found", "Users not found: " + missing);
        }
        Long assignedBy = resolveActorId(actorPublicId);

        groupRepository.deleteAllMembers(group.getId());
        users.forEach(user -> groupRepository.insertMember(group.getId(), user.getId(), assignedBy));
        log.info("Replaced group members: group_id={} members={} assigned_by={}",
                groupPublicId, users.size(), actorPublicId);
        return groupRepository.findMemberPublicIds(group.getId());
    }

    public void removeGroupMember(@NonNull String groupPublicId, @NonNull String userPublicId) {
        GroupEntity group = findGroup(groupPublicId);
        UserEntity user = findUser(userPublicId);
        if (groupRepository.deleteMember(group.getId(), user.getId()) == 0) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "access.member_not_found",
                    "User is not a member of group: " + groupPublicId);
        }
        log.info("Removed group member: group_id={} user_id={}", groupPublicId, userPublicId);
    }

    @Transactional(readOnly = true)
    public List<String> getGroupRoles(@NonNull String groupPublicId) {
        GroupEntity group = findGroup(groupPublicId);
        return groupRepository.findRoleNames(group.getId());
    }

    public List<String> replaceGroupRoles(@NonNull String groupPublicId, @NonNull Collection<String> roleNames) {
        GroupEntity group = findGroup(groupPublicId);
        List<RoleEntity> roles = findRoles(roleNames);

        groupRepository.deleteAllRoles(group.getId());
        roles.forEach(role -> groupRepository.insertRole(group.getId(), role.getId()));
        log.info("Replaced group roles: group_id={} roles={}", groupPublicId, roleNames);
        return groupRepository.findRoleNames(group.getId());
    }

    public void removeGroupRole(@NonNull String groupPublicId, @NonNull String roleName) {
        GroupEntity group = findGroup(groupPublicId);
        RoleEntity role = roleRepository.findByName(roleName)
                .orElseThrow(() -> roleNotFound(roleName));
        if (groupRepository.deleteRole(group.getId(), role.getId()) == 0) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "access.role_not_assigned",
                    "Role not found in group: " + roleName);
        }
        log.info("Removed group role: group_id={} role={}", groupPublicId, roleName);
    }

    private UserEntity findUser(String userPublicId) {
        UUID publicId;
        try {
            publicId = UUID.fromString(userPublicId);
        } catch (IllegalArgumentException ex) {
            throw userNotFound();
        }
        return userRepository.findByPublicIdAndDeletedFalse(publicId)
                .orElseThrow(AccessAdminService::userNotFound);
    }

    private GroupEntity findGroup(String groupPublicId) {
        return groupRepository.findByPublicId(groupPublicId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "access.group_not_found",
                        "Group not found"));
    }

    private List<RoleEntity> findRoles(Collection<String> roleNames) {
        Set<String> requested = new LinkedHashSet<>(roleNames);
        List<RoleEntity> roles = roleRepository.findByNameIn(requested);
        if (roles.size() != requested.size()) {
            Set<String> found = roles.stream().map(RoleEntity::getName).collect(Collectors.toSet());
            String missing = requested.stream()
                    .filter(name -> !found.contains(name))
                    .collect(Collectors.joining(", "));
            throw roleNotFound(missing);
        }
        return roles;
    }

    private Long resolveActorId(String actorPublicId) {
        if (actorPublicId == null) {
            return null;
        }
        try {
            return userRepository.findByPublicIdAndDeletedFalse(UUID.fromString(actorPublicId))
                    .map(UserEntity::getId)
                    .orElse(null);
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    private static ProblemException userNotFound() {
        return new ProblemException(HttpStatus.NOT_FOUND, "access.user_not_found", "User not found");
    }

    private static ProblemException roleNotFound(String roleNames) {
        return new ProblemException(HttpStatus.NOT_FOUND, "access.role_not_found", "Role not found: " + roleNames);
    }
}
