package com.knowledgecenter.backend.modules.rbac.presentation;

import com.knowledgecenter.backend.global.error.ProblemException;
import com.knowledgecenter.backend.global.security.RequireRoles;
import com.knowledgecenter.backend.modules.auth.domain.Roles;
import com.knowledgecenter.backend.modules.auth.presentation.dto.MessageResponse;
import com.knowledgecenter.backend.modules.rbac.application.PermissionService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "admin")
public class PermissionAdminController {

    private static final Logger log = LoggerFactory.getLogger(PermissionAdminController.class);

    private final PermissionService permissionService;

    public PermissionAdminController(PermissionService permissionService) {
        this.permissionService = permissionService;
    }

    @PostMapping("/admin/refresh-permissions")
    @RequireRoles(Roles.FULL_ACCESS)
    @Operation(summary = "Reload API permission rules into the in-memory table",
            security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<MessageResponse> refreshPermissions() {
        try {
            permissionService.reload();
        } catch (DataAccessException ex) {
            log.error("Permission refresh failed", ex);
            throw new ProblemException(HttpStatus.INTERNAL_SERVER_ERROR, "permission_refresh_failed",
                    "Failed to refresh permissions");
        }
        return ResponseEntity.ok(new MessageResponse("Permissions refreshed successfully"));
    }
}
