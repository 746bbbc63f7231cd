package com.knowledgecenter.backend.modules.access.presentation;

import com.knowledgecenter.backend.modules.access.application.AccessAdminService;
import com.knowledgecenter.backend.modules.access.presentation.dto.GroupSummaryResponse;
import com.knowledgecenter.backend.modules.access.presentation.dto.RoleNamesResponse;
import com.knowledgecenter.backend.modules.access.presentation.dto.UpdateRolesRequest;
import com.knowledgecenter.backend.modules.access.presentation.dto.UserGroupsResponse;

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

/**
 * Direct role and group lookups for a single user. Access is governed by the permission table.
 */
@RestController
@RequestMapping("/users/{userId}")
@Tag(name = "access")
public class UserAccessController {

    private final AccessAdminService accessAdminService;

    public UserAccessController(AccessAdminService accessAdminService) {
        this.accessAdminService = accessAdminService;
    }

    @GetMapping("/roles")
    @Operation(summary = "Direct roles of a user")
    public ResponseEntity<RoleNamesResponse> getRoles(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(new RoleNamesResponse(accessAdminService.getUserRoles(userId)));
    }

    @PutMapping("/roles")
    @Operation(summary = "Replace the direct roles of a user")
    public ResponseEntity<RoleNamesResponse> replaceRoles(
            @PathVariable("userId") String userId,
            @Valid @RequestBody UpdateRolesRequest request
    ) {
        return ResponseEntity.ok(new RoleNamesResponse(
                accessAdminService.replaceUserRoles(userId, request.roleNames())));
    }

    @DeleteMapping("/roles/{roleName}")
    @Operation(summary = "Remove one direct role")
    public ResponseEntity<Void> removeRole(
            @PathVariable("userId") String userId,
            @PathVariable("roleName") String roleName
    ) {
        accessAdminService.removeUserRole(userId, roleName);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/groups")
    @Operation(summary = "Groups a user belongs to")
    public ResponseEntity<UserGroupsResponse> getGroups(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(new UserGroupsResponse(accessAdminService.getUserGroups(userId).stream()
                .map(GroupSummaryResponse::from)
                .toList()));
    }
}
