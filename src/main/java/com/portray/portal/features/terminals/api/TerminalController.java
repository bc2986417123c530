package com.portray.portal.features.terminals.api;

import com.portray.portal.common.security.UserPrincipal;
import com.portray.portal.features.terminals.api.dto.*;
import com.portray.portal.features.terminals.app.*;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Terminal lifecycle endpoints.
 * Role checks for activation and status changes live in the handlers.
 */
@RestController
@RequestMapping("/api")
public class TerminalController {

    private final SubmitTerminalHandler submitHandler;
    private final UpdateTerminalHandler updateHandler;
    private final ActivateTerminalHandler activateHandler;
    private final ChangeTerminalStatusHandler changeStatusHandler;
    private final DeleteTerminalHandler deleteHandler;
    private final TerminalQueryService queryService;

    public TerminalController(
            SubmitTerminalHandler submitHandler,
            UpdateTerminalHandler updateHandler,
            ActivateTerminalHandler activateHandler,
            ChangeTerminalStatusHandler changeStatusHandler,
            DeleteTerminalHandler deleteHandler,
            TerminalQueryService queryService) {
        this.submitHandler = submitHandler;
        this.updateHandler = updateHandler;
        this.activateHandler = activateHandler;
        this.changeStatusHandler = changeStatusHandler;
        this.deleteHandler = deleteHandler;
        this.queryService = queryService;
    }

    @GetMapping("/ports/{portId}/terminals")
    public ResponseEntity<List<TerminalView>> listByPort(@PathVariable Long portId) {
        return ResponseEntity.ok(queryService.listByPort(portId));
    }

    @PostMapping("/ports/{portId}/terminals")
    public ResponseEntity<TerminalView> submit(
            @PathVariable Long portId,
            @Valid @RequestBody CreateTerminalRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.status(HttpStatus.CREATED).body(submitHandler.handle(portId, request, principal));
    }

    @GetMapping("/terminals/pending-activation")
    @PreAuthorize("hasRole('SYSTEM_ADMIN')")
    public ResponseEntity<List<TerminalView>> pendingActivation() {
        return ResponseEntity.ok(queryService.pendingActivation());
    }

    @GetMapping("/terminals/{id}")
    public ResponseEntity<TerminalView> get(@PathVariable Long id) {
        return ResponseEntity.ok(queryService.get(id));
    }

    @PutMapping("/terminals/{id}")
    public ResponseEntity<TerminalView> update(
            @PathVariable Long id,
            @Valid @RequestBody UpdateTerminalRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(updateHandler.handle(id, request, principal));
    }

    @PutMapping("/terminals/{id}/activate")
    public ResponseEntity<TerminalView> activate(
            @PathVariable Long id,
            @Valid @RequestBody ActivateTerminalRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(activateHandler.handle(id, request, principal));
    }

    @PutMapping("/terminals/{id}/status")
    public ResponseEntity<TerminalView> changeStatus(
            @PathVariable Long id,
            @Valid @RequestBody ChangeStatusRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(changeStatusHandler.handle(id, request.status(), principal));
    }

    @DeleteMapping("/terminals/{id}")
    public ResponseEntity<Void> delete(
            @PathVariable Long id,
            @AuthenticationPrincipal UserPrincipal principal) {
        deleteHandler.handle(id, principal);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/terminals/{id}/activation-log")
    public ResponseEntity<List<ActivationLogView>> activationLog(@PathVariable Long id) {
        return ResponseEntity.ok(queryService.activationLog(id));
    }

    @GetMapping("/subscription-types")
    public ResponseEntity<List<SubscriptionTypeView>> subscriptionTypes() {
        return ResponseEntity.ok(queryService.subscriptionTypes());
    }
}
