package com.portray.portal.features.auth.api;

import com.portray.portal.common.exception.AuthenticationFailedException;
import com.portray.portal.common.security.OpaqueTokens;
import com.portray.portal.common.security.UserPrincipal;
import com.portray.portal.features.auth.api.dto.LoginRequest;
import com.portray.portal.features.auth.api.dto.LoginResponse;
import com.portray.portal.features.auth.api.dto.RefreshResponse;
import com.portray.portal.features.auth.api.dto.UserView;
import com.portray.portal.features.auth.app.AuthService;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @PostMapping("/logout")
    public ResponseEntity<Map<String, String>> logout(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        authService.logout(OpaqueTokens.bearerToken(authorization));
        return ResponseEntity.ok(Map.of("message", "Logged out successfully"));
    }

    @GetMapping("/me")
    public ResponseEntity<Map<String, UserView>> me(@AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(Map.of("user", authService.currentUser(principal.getUserId())));
    }

    @PostMapping("/refresh")
    public ResponseEntity<RefreshResponse> refresh(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String token = OpaqueTokens.bearerToken(authorization);
        if (token == null) {
            throw new AuthenticationFailedException("Token required");
        }
        return ResponseEntity.ok(authService.refresh(token));
    }
}
