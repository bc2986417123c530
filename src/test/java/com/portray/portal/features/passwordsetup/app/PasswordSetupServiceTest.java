package com.portray.portal.features.passwordsetup.app;

import com.portray.portal.common.config.PortalProperties;
import com.portray.portal.common.exception.InvalidTokenException;
import com.portray.portal.common.security.SetupTokenProvider;
import com.portray.portal.common.security.UserRole;
import com.portray.portal.features.audit.app.AuditService;
import com.portray.portal.features.auth.api.dto.LoginResponse;
import com.portray.portal.features.auth.app.SessionService;
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
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class PasswordSetupServiceTest {

    private static final Instant NOW = Instant.parse("2025-04-02T10:00:00Z");

    private UserRepository userRepository;
    private SessionService sessionService;
    private AuditService auditService;
    private SetupTokenProvider setupTokenProvider;
    private PasswordSetupService service;
    private User provisioned;

    @BeforeEach
    void setUp() {
        userRepository = mock(UserRepository.class);
        sessionService = mock(SessionService.class);
        auditService = mock(AuditService.class);
        PasswordEncoder passwordEncoder = mock(PasswordEncoder.class);
        when(passwordEncoder.encode("s3cure-pass")).thenReturn("bcrypt-hash");

        MutableClock clock = new MutableClock(NOW);
        PortalProperties properties = new PortalProperties();
        properties.getSetupToken().setSecret("unit-test-setup-token-secret-0123456789abcdef");
        setupTokenProvider = new SetupTokenProvider(properties, clock);

        service = new PasswordSetupService(userRepository, passwordEncoder, setupTokenProvider,
                sessionService, auditService, clock);

        provisioned = User.provisioned("pa@example.com", "Port", "Admin", UserRole.PORT_ADMIN);
        when(userRepository.findById(provisioned.getUserId())).thenReturn(Optional.of(provisioned));
        when(sessionService.createSession(anyString(), anyBoolean())).thenAnswer(inv ->
                new SessionService.IssuedSession("session-token", inv.getArgument(0), NOW.plusSeconds(86400)));
    }

    @Test
    @DisplayName("Setting the first password activates the account and signs in")
    void completesSetup() {
        String token = setupTokenProvider.generateToken(provisioned.getUserId());

        LoginResponse response = service.setupPassword(provisioned.getUserId(), "s3cure-pass", token);

        assertTrue(provisioned.isActive());
        assertEquals("bcrypt-hash", provisioned.getPasswordHash());
        assertEquals(NOW, provisioned.getLastLogin());
        assertEquals("session-token", response.token());
        assertEquals("/dashboard", response.redirectPath());
        verify(auditService).logPasswordSetup(provisioned.getUserId());
    }

    @Test
    @DisplayName("Token issued for another user is rejected")
    void tokenForAnotherUser() {
        String token = setupTokenProvider.generateToken("user_someone_else");

        assertThrows(InvalidTokenException.class,
                () -> service.setupPassword(provisioned.getUserId(), "s3cure-pass", token));
        assertFalse(provisioned.isActive());
        verifyNoInteractions(sessionService);
    }

    @Test
    @DisplayName("Setup cannot overwrite an existing password")
    void passwordAlreadySet() {
        User existing = new User("user_set", "x@example.com", "old-hash", "X", "Y", UserRole.PORT_ADMIN);
        when(userRepository.findById("user_set")).thenReturn(Optional.of(existing));
        String token = setupTokenProvider.generateToken("user_set");

        assertThrows(IllegalStateException.class, () -> service.setupPassword("user_set", "s3cure-pass", token));
        assertEquals("old-hash", existing.getPasswordHash());
    }
}
