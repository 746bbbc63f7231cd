package com.knowledgecenter.backend.modules.access.presentation;

import com.knowledgecenter.backend.global.security.SecurityUtils;
import com.knowledgecenter.backend.modules.access.application.AccessAdminService;
import com.knowledgecenter.backend.modules.access.presentation.dto.GroupMembersResponse;
import com.knowledgecenter.backend.modules.access.presentation.dto.RoleNamesResponse;
import com.knowledgecenter.backend.modules.access.presentation.dto.UpdateGroupMembersRequest;
import com.knowledgecenter.backend.modules.access.presentation.dto.UpdateRolesRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/groups/{groupId}")
@Tag(name = "access")
public class GroupAccessController {

    private final AccessAdminService accessAdminService;

    public GroupAccessController(AccessAdminService accessAdminService) {
        this.accessAdminService = accessAdminService;
    }

    @GetMapping("/users")
    @Operation(summary = "Members of a group")
    public ResponseEntity<GroupMembersResponse> getMembers(@PathVariable("groupId") String groupId) {
        return ResponseEntity.ok(new GroupMembersResponse(groupId, accessAdminService.getGroupMembers(groupId)));
    }

    @PutMapping("/users")
    @Operation(summary = "Replace the members of a group")
    public ResponseEntity<GroupMembersResponse> replaceMembers(
            @PathVariable("groupId") String groupId,
            @Valid @RequestBody UpdateGroupMembersRequest request
    ) {
        return ResponseEntity.ok(new GroupMembersResponse(groupId, accessAdminService.replaceGroupMembers(
                groupId, request.userIds(), SecurityUtils.getCurrentUserId())));
    }

    @DeleteMapping("/users/{userId}")
    @Operation(summary = "Remove one member")
    public ResponseEntity<Void> removeMember(
            @PathVariable("groupId") String groupId,
            @PathVariable("userId") String userId
    ) {
        accessAdminService.removeGroupMember(groupId, userId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/roles")
    @Operation(summary = "Roles granted through a group")
    public ResponseEntity<RoleNamesResponse> getRoles(@PathVariable("groupId") String groupId) {
        return ResponseEntity.ok(new RoleNamesResponse(accessAdminService.getGroupRoles(groupId)));
    }

    @PutMapping("/roles")
    @Operation(summary = "Replace the roles of a group")
    public ResponseEntity<RoleNamesResponse> replaceRoles(
            @PathVariable("groupId") String groupId,
            @Valid @RequestBody UpdateRolesRequest request
    ) {
        return ResponseEntity.ok(new RoleNamesResponse(
                accessAdminService.replaceGroupRoles(groupId, request.roleNames())));
    }

    @DeleteMapping("/roles/{roleName}")
    @Operation(summary = "Remove one role from a group")
    public ResponseEntity<Void> removeRole(
            @PathVariable("groupId") String groupId,
            @PathVariable("roleName") String roleName
    ) {
        accessAdminService.removeGroupRole(groupId, roleName);
        return ResponseEntity.noContent().build();
    }
}
