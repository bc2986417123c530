package com.portray.portal.features.auth.app;

import com.portray.portal.common.exception.AuthenticationFailedException;
import com.portray.portal.common.security.UserRole;
import com.portray.portal.features.audit.app.AuditService;
import com.portray.portal.features.auth.api.dto.LoginRequest;
import com.portray.portal.features.auth.api.dto.LoginResponse;
import com.portray.portal.features.auth.domain.User;
import com.portray.portal.features.auth.domain.UserRepository;
import com.portray.portal.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class AuthServiceTest {

    private static final Instant NOW = Instant.parse("2025-05-01T08:30:00Z");

    private UserRepository userRepository;
    private PasswordEncoder passwordEncoder;
    private SessionService sessionService;
    private AuditService auditService;
    private AuthService authService;

    @BeforeEach
    void setUp() {
        userRepository = mock(UserRepository.class);
        passwordEncoder = mock(PasswordEncoder.class);
        sessionService = mock(SessionService.class);
        auditService = mock(AuditService.class);
        authService = new AuthService(userRepository, passwordEncoder, sessionService, auditService,
                new MutableClock(NOW));

        when(passwordEncoder.matches("correct-password", "hashed")).thenReturn(true);
        when(sessionService.createSession(anyString(), anyBoolean())).thenAnswer(inv ->
                new SessionService.IssuedSession("opaque-token", inv.getArgument(0), NOW.plusSeconds(3600)));
    }

    @Test
    @DisplayName("SystemAdmin login lands on the welcome page and records the login")
    void adminLogin() {
        User admin = new User("user_admin", "admin@example.com", "hashed", "Sys", "Admin", UserRole.SYSTEM_ADMIN);
        when(userRepository.findByEmail("admin@example.com")).thenReturn(Optional.of(admin));

        LoginResponse response = authService.login(new LoginRequest("admin@example.com", "correct-password", null));

        assertEquals("opaque-token", response.token());
        assertEquals("/portal/welcome", response.redirectPath());
        assertEquals(NOW, admin.getLastLogin());
        verify(sessionService).createSession("user_admin", false);
        verify(auditService).logLogin("user_admin");
    }

    @Test
    @DisplayName("PortAdmin login lands on the dashboard; remember-me is passed through")
    void portAdminLogin() {
        User portAdmin = new User("user_pa", "pa@example.com", "hashed", "Port", "Admin", UserRole.PORT_ADMIN);
        when(userRepository.findByEmail("pa@example.com")).thenReturn(Optional.of(portAdmin));

        LoginResponse response = authService.login(new LoginRequest("pa@example.com", "correct-password", true));

        assertEquals("/dashboard", response.redirectPath());
        verify(sessionService).createSession("user_pa", true);
    }

    @Test
    @DisplayName("Unknown email, wrong password and inactive account fail with the same message")
    void failuresAreIndistinguishable() {
        User inactive = new User("user_in", "in@example.com", "hashed", "In", "Active", UserRole.USER);
        inactive.toggleActive();
        User active = new User("user_ok", "ok@example.com", "hashed", "Ok", "User", UserRole.USER);
        when(userRepository.findByEmail("missing@example.com")).thenReturn(Optional.empty());
        when(userRepository.findByEmail("in@example.com")).thenReturn(Optional.of(inactive));
        when(userRepository.findByEmail("ok@example.com")).thenReturn(Optional.of(active));

        String unknown = assertThrows(AuthenticationFailedException.class,
                () -> authService.authenticate("missing@example.com", "correct-password")).getMessage();
        String wrongPassword = assertThrows(AuthenticationFailedException.class,
                () -> authService.authenticate("ok@example.com", "wrong-password")).getMessage();
        String disabled = assertThrows(AuthenticationFailedException.class,
                () -> authService.authenticate("in@example.com", "correct-password")).getMessage();

        assertEquals("Invalid email or password", unknown);
        assertEquals(unknown, wrongPassword);
        assertEquals(unknown, disabled);
        verify(sessionService, never()).createSession(anyString(), anyBoolean());
    }

    @Test
    @DisplayName("A provisioned account without a password cannot log in")
    void provisionedAccountCannotLogIn() {
        User provisioned = User.provisioned("new@example.com", "New", "Admin", UserRole.PORT_ADMIN);
        provisioned.toggleActive();
        when(userRepository.findByEmail("new@example.com")).thenReturn(Optional.of(provisioned));

        assertThrows(AuthenticationFailedException.class,
                () -> authService.authenticate("new@example.com", User.PASSWORD_NOT_SET));
        verify(passwordEncoder, never()).matches(any(), any());
    }

    @Test
    @DisplayName("Refresh with a dead token is rejected")
    void refreshRequiresLiveSession() {
        when(sessionService.resolveSession("stale")).thenReturn(Optional.empty());

        assertThrows(AuthenticationFailedException.class, () -> authService.refresh("stale"));
        verify(sessionService, never()).revoke(anyString());
    }
}
