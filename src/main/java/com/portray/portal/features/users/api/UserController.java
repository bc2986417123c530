package com.portray.portal.features.users.api;

import com.portray.portal.common.security.UserPrincipal;
import com.portray.portal.features.audit.api.dto.UserAuditLogView;
import com.portray.portal.features.audit.app.AuditService;
import com.portray.portal.features.auth.api.dto.UserView;
import com.portray.portal.features.users.api.dto.ChangeRoleRequest;
import com.portray.portal.features.users.api.dto.CreateUserRequest;
import com.portray.portal.features.users.api.dto.UpdateUserRequest;
import com.portray.portal.features.users.app.UserAdminService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/users")
@PreAuthorize("hasRole('SYSTEM_ADMIN')")
public class UserController {

    private final UserAdminService userAdminService;
    private final AuditService auditService;

    public UserController(UserAdminService userAdminService, AuditService auditService) {
        this.userAdminService = userAdminService;
        this.auditService = auditService;
    }

    @GetMapping
    public ResponseEntity<List<UserView>> list() {
        return ResponseEntity.ok(userAdminService.list());
    }

    @GetMapping("/{id}")
    public ResponseEntity<UserView> get(@PathVariable String id) {
        return ResponseEntity.ok(userAdminService.get(id));
    }

    @PostMapping
    public ResponseEntity<UserView> create(
            @Valid @RequestBody CreateUserRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(userAdminService.create(request, principal.getUserId()));
    }

    @PutMapping("/{id}")
    public ResponseEntity<UserView> update(
            @PathVariable String id,
            @Valid @RequestBody UpdateUserRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(userAdminService.update(id, request, principal.getUserId()));
    }

    @PatchMapping("/{id}/role")
    public ResponseEntity<UserView> changeRole(
            @PathVariable String id,
            @Valid @RequestBody ChangeRoleRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(userAdminService.changeRole(id, request.role(), principal.getUserId()));
    }

    @PatchMapping("/{id}/toggle-status")
    public ResponseEntity<UserView> toggleStatus(
            @PathVariable String id,
            @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(userAdminService.toggleStatus(id, principal.getUserId()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(
            @PathVariable String id,
            @AuthenticationPrincipal UserPrincipal principal) {
        userAdminService.delete(id, principal.getUserId());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/audit-logs")
    public ResponseEntity<List<UserAuditLogView>> auditLogs(@PathVariable String id) {
        return ResponseEntity.ok(auditService.history(id).stream()
                .map(UserAuditLogView::from)
                .toList());
    }
}
