package com.portray.portal.features.ports.api;

import com.portray.portal.features.contacts.api.dto.ContactView;
import com.portray.portal.features.contacts.app.ContactService;
import com.portray.portal.features.ports.api.dto.PortRequest;
import com.portray.portal.features.ports.api.dto.PortView;
import com.portray.portal.features.ports.app.PortService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/ports")
public class PortController {

    private final PortService portService;
    private final ContactService contactService;

    public PortController(PortService portService, ContactService contactService) {
        this.portService = portService;
        this.contactService = contactService;
    }

    @GetMapping
    public ResponseEntity<List<PortView>> list() {
        return ResponseEntity.ok(portService.list());
    }

    @GetMapping("/{id}")
    public ResponseEntity<PortView> get(@PathVariable Long id) {
        return ResponseEntity.ok(portService.get(id));
    }

    @PostMapping
    @PreAuthorize("hasRole('SYSTEM_ADMIN')")
    public ResponseEntity<PortView> create(@Valid @RequestBody PortRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(portService.create(request));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('SYSTEM_ADMIN')")
    public ResponseEntity<PortView> update(@PathVariable Long id, @Valid @RequestBody PortRequest request) {
        return ResponseEntity.ok(portService.update(id, request));
    }

    @PatchMapping("/{id}/toggle-status")
    @PreAuthorize("hasRole('SYSTEM_ADMIN')")
    public ResponseEntity<PortView> toggleStatus(@PathVariable Long id) {
        return ResponseEntity.ok(portService.toggleStatus(id));
    }

    @GetMapping("/{id}/contacts")
    public ResponseEntity<List<ContactView>> contacts(@PathVariable Long id) {
        return ResponseEntity.ok(contactService.listByPort(id));
    }
}
