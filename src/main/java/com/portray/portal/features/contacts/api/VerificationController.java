package com.portray.portal.features.contacts.api;

import com.portray.portal.features.contacts.api.dto.ContactView;
import com.portray.portal.features.contacts.api.dto.VerificationResponse;
import com.portray.portal.features.contacts.app.ContactVerificationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public endpoint hit from the emailed verification link.
 */
@RestController
public class VerificationController {

    private final ContactVerificationService verificationService;

    public VerificationController(ContactVerificationService verificationService) {
        this.verificationService = verificationService;
    }

    @GetMapping("/api/verify")
    public ResponseEntity<VerificationResponse> verify(@RequestParam(required = false) String token) {
        ContactVerificationService.VerificationResult result = verificationService.consumeVerification(token);
        return ResponseEntity.ok(new VerificationResponse(
                "Email verified successfully",
                ContactView.from(result.contact()),
                result.userId(),
                result.requiresPasswordSetup(),
                result.setupToken()));
    }
}
