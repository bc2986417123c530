package com.portray.portal.features.audit.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portray.portal.common.security.UserRole;
import com.portray.portal.common.tx.SideEffectExecutor;
import com.portray.portal.features.audit.domain.UserAuditLog;
import com.portray.portal.features.audit.domain.UserAuditLogRepository;
import com.portray.portal.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AuditServiceTest {

    private static final Instant NOW = Instant.parse("2025-02-10T12:00:00Z");

    private UserAuditLogRepository repository;
    private AuditService auditService;

    @BeforeEach
    void setUp() {
        repository = mock(UserAuditLogRepository.class);
        auditService = new AuditService(repository,
                new SideEffectExecutor(mock(PlatformTransactionManager.class)),
                new ObjectMapper(), new MutableClock(NOW));
    }

    private static UserSnapshot snapshot(String email, String firstName, String role) {
        return new UserSnapshot(email, firstName, "Doe", null, role, null, List.of(), true);
    }

    @Test
    @DisplayName("Update with no tracked change writes no entry")
    void unchangedUpdateIsNoOp() {
        UserSnapshot same = snapshot("jane@example.com", "Jane", "user");

        auditService.logUserUpdate("user_1", "user_admin", same, same);

        verifyNoInteractions(repository);
    }

    @Test
    @DisplayName("Update lists every changed field in the description")
    void updateDescribesChanges() {
        auditService.logUserUpdate("user_1", "user_admin",
                snapshot("jane@example.com", "Jane", "user"),
                snapshot("janet@example.com", "Janet", "user"));

        ArgumentCaptor<UserAuditLog> entry = ArgumentCaptor.forClass(UserAuditLog.class);
        verify(repository).save(entry.capture());
        assertEquals("updated", entry.getValue().getAction());
        assertEquals("User profile updated: email changed from jane@example.com to janet@example.com, "
                + "first name changed from Jane to Janet", entry.getValue().getDescription());
        assertTrue(entry.getValue().getOldValues().contains("jane@example.com"));
        assertEquals(NOW, entry.getValue().getCreatedAt());
    }

    @Test
    @DisplayName("Role change records both labels")
    void roleChange() {
        auditService.logUserRoleChange("user_1", "user_admin", UserRole.USER, UserRole.PORT_ADMIN);

        ArgumentCaptor<UserAuditLog> entry = ArgumentCaptor.forClass(UserAuditLog.class);
        verify(repository).save(entry.capture());
        assertEquals("role_changed", entry.getValue().getAction());
        assertEquals("User role changed from user to PortAdmin", entry.getValue().getDescription());
        assertEquals("{\"role\":\"PortAdmin\"}", entry.getValue().getNewValues());
    }

    @Test
    @DisplayName("A failing write is swallowed")
    void failingWriteDoesNotPropagate() {
        when(repository.save(any())).thenThrow(new IllegalStateException("db down"));

        assertDoesNotThrow(() -> auditService.logLogin("user_1"));
        verify(repository).save(any());
    }
}
