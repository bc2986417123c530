package com.portray.portal.features.emaillogs.api;

import com.portray.portal.features.emaillogs.api.dto.EmailLogView;
import com.portray.portal.features.emaillogs.app.EmailLogService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/email-logs")
public class EmailLogController {

    private final EmailLogService emailLogService;

    public EmailLogController(EmailLogService emailLogService) {
        this.emailLogService = emailLogService;
    }

    @GetMapping
    @PreAuthorize("hasRole('SYSTEM_ADMIN')")
    public ResponseEntity<List<EmailLogView>> list(
            @RequestParam(required = false) Long portId,
            @RequestParam(required = false) Long contactId) {
        return ResponseEntity.ok(emailLogService.list(portId, contactId));
    }
}
