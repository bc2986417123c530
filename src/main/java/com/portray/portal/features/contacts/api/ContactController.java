package com.portray.portal.features.contacts.api;

import com.portray.portal.features.contacts.api.dto.ContactRequest;
import com.portray.portal.features.contacts.api.dto.ContactView;
import com.portray.portal.features.contacts.api.dto.UpdateContactRequest;
import com.portray.portal.features.contacts.app.ContactService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/contacts")
public class ContactController {

    private final ContactService contactService;

    public ContactController(ContactService contactService) {
        this.contactService = contactService;
    }

    @GetMapping
    public ResponseEntity<List<ContactView>> list(@RequestParam(required = false) Long portId) {
        return ResponseEntity.ok(portId != null ? contactService.listByPort(portId) : contactService.list());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ContactView> get(@PathVariable Long id) {
        return ResponseEntity.ok(contactService.get(id));
    }

    @PostMapping
    public ResponseEntity<ContactView> create(@Valid @RequestBody ContactRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(contactService.create(request));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<ContactView> update(
            @PathVariable Long id,
            @Valid @RequestBody UpdateContactRequest request) {
        return ResponseEntity.ok(contactService.update(id, request));
    }

    @PatchMapping("/{id}/toggle-status")
    public ResponseEntity<ContactView> toggleStatus(@PathVariable Long id) {
        return ResponseEntity.ok(contactService.toggleStatus(id));
    }

    @PostMapping("/{id}/resend-verification")
    public ResponseEntity<Map<String, Object>> resendVerification(@PathVariable Long id) {
        ContactView contact = contactService.resendVerification(id);
        return ResponseEntity.ok(Map.of(
                "message", "Verification email sent",
                "contact", contact));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        contactService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
