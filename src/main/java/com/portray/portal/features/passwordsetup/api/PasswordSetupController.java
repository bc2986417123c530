package com.portray.portal.features.passwordsetup.api;

import com.portray.portal.features.auth.api.dto.LoginResponse;
import com.portray.portal.features.passwordsetup.api.dto.SetupPasswordRequest;
import com.portray.portal.features.passwordsetup.app.PasswordSetupService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class PasswordSetupController {

    private final PasswordSetupService passwordSetupService;

    public PasswordSetupController(PasswordSetupService passwordSetupService) {
        this.passwordSetupService = passwordSetupService;
    }

    @PostMapping("/api/setup-password")
    public ResponseEntity<LoginResponse> setupPassword(@Valid @RequestBody SetupPasswordRequest request) {
        return ResponseEntity.ok(passwordSetupService.setupPassword(
                request.userId(), request.password(), request.setupToken()));
    }
}
