package com.portray.portal.features.organizations.api;

import com.portray.portal.features.organizations.api.dto.OrganizationRequest;
import com.portray.portal.features.organizations.api.dto.OrganizationView;
import com.portray.portal.features.organizations.api.dto.UpdateOrganizationRequest;
import com.portray.portal.features.organizations.app.OrganizationService;
import com.portray.portal.features.ports.api.dto.PortView;
import com.portray.portal.features.ports.app.PortService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Organization administration. Reads are open to any signed-in user; writes need SystemAdmin.
 */
@RestController
@RequestMapping("/api/organizations")
public class OrganizationController {

    private final OrganizationService organizationService;
    private final PortService portService;

    public OrganizationController(OrganizationService organizationService, PortService portService) {
        this.organizationService = organizationService;
        this.portService = portService;
    }

    @GetMapping
    public ResponseEntity<List<OrganizationView>> list() {
        return ResponseEntity.ok(organizationService.list());
    }

    @GetMapping("/{id}")
    public ResponseEntity<OrganizationView> get(@PathVariable Long id) {
        return ResponseEntity.ok(organizationService.get(id));
    }

    @GetMapping("/{id}/ports")
    public ResponseEntity<List<PortView>> ports(@PathVariable Long id) {
        return ResponseEntity.ok(portService.listByOrganization(id));
    }

    @PostMapping
    @PreAuthorize("hasRole('SYSTEM_ADMIN')")
    public ResponseEntity<OrganizationView> create(@Valid @RequestBody OrganizationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(organizationService.create(request));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('SYSTEM_ADMIN')")
    public ResponseEntity<OrganizationView> update(
            @PathVariable Long id,
            @Valid @RequestBody UpdateOrganizationRequest request) {
        return ResponseEntity.ok(organizationService.update(id, request));
    }

    @PatchMapping("/{id}/toggle-status")
    @PreAuthorize("hasRole('SYSTEM_ADMIN')")
    public ResponseEntity<OrganizationView> toggleStatus(@PathVariable Long id) {
        return ResponseEntity.ok(organizationService.toggleStatus(id));
    }
}
