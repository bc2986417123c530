package com.portray.portal.features.terminals.app;

import com.portray.portal.common.outbox.OutboxService;
import com.portray.portal.features.terminals.TerminalFixtures;
import com.portray.portal.features.terminals.api.dto.ActivateTerminalRequest;
import com.portray.portal.features.terminals.api.dto.TerminalView;
import com.portray.portal.features.terminals.domain.ActivationLog;
import com.portray.portal.features.terminals.domain.SubscriptionType;
import com.portray.portal.features.terminals.domain.SubscriptionTypeRepository;
import com.portray.portal.features.terminals.domain.Terminal;
import com.portray.portal.features.terminals.domain.TerminalRepository;
import com.portray.portal.features.terminals.domain.TerminalStatus;
import com.portray.portal.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.security.access.AccessDeniedException;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ActivateTerminalHandlerTest {

    private TerminalRepository terminalRepository;
    private SubscriptionTypeRepository subscriptionTypeRepository;
    private ActivationLogWriter activationLogWriter;
    private TerminalNotifier notifier;
    private ActivateTerminalHandler handler;

    @BeforeEach
    void setUp() {
        terminalRepository = mock(TerminalRepository.class);
        subscriptionTypeRepository = mock(SubscriptionTypeRepository.class);
        activationLogWriter = mock(ActivationLogWriter.class);
        notifier = mock(TerminalNotifier.class);
        handler = new ActivateTerminalHandler(terminalRepository, subscriptionTypeRepository,
                mock(OutboxService.class), activationLogWriter, notifier,
                new MutableClock(Instant.parse("2025-01-01T06:00:00Z")));

        when(terminalRepository.save(any(Terminal.class))).thenAnswer(inv -> inv.getArgument(0));
        when(subscriptionTypeRepository.findById(2)).thenReturn(Optional.of(TerminalFixtures.TWELVE_MONTHS));
        when(subscriptionTypeRepository.findById(99)).thenReturn(Optional.empty());
    }

    private static ActivateTerminalRequest request(int subscriptionTypeId) {
        return new ActivateTerminalRequest(LocalDate.of(2025, 1, 1), subscriptionTypeId, "WO-77",
                LocalDate.of(2024, 12, 15));
    }

    @Test
    @DisplayName("SystemAdmin activation sets a 12 month window, logs once and notifies the submitter")
    void activates() {
        Terminal terminal = TerminalFixtures.processingTerminal();
        when(terminalRepository.findById(5L)).thenReturn(Optional.of(terminal));

        TerminalView view = handler.handle(5L, request(2), TerminalFixtures.ADMIN);

        assertEquals(TerminalStatus.ACTIVE, view.status());
        assertEquals(LocalDate.of(2026, 1, 1), terminal.getActivationEndDate());
        assertEquals("WO-77", terminal.getWorkOrderNo());

        ArgumentCaptor<String> description = ArgumentCaptor.forClass(String.class);
        verify(activationLogWriter, times(1)).append(eq(terminal), eq(ActivationLog.ACTIVATED),
                description.capture(), eq("user_admin"));
        assertTrue(description.getValue().startsWith("Terminal activated with 12 month(s) subscription"));
        assertTrue(description.getValue().contains("from 2025-01-01 to 2026-01-01"));
        verify(notifier).approved(terminal);
    }

    @Test
    @DisplayName("Non-admin activation is forbidden and leaves the terminal untouched")
    void forbiddenForPortAdmin() {
        Terminal terminal = TerminalFixtures.processingTerminal();
        when(terminalRepository.findById(5L)).thenReturn(Optional.of(terminal));

        assertThrows(AccessDeniedException.class, () -> handler.handle(5L, request(2), TerminalFixtures.PORT_ADMIN));

        assertEquals(TerminalStatus.PROCESSING_FOR_ACTIVATION, terminal.getStatus());
        assertNull(terminal.getActivationStartDate());
        verify(terminalRepository, never()).save(any());
        verifyNoInteractions(activationLogWriter, notifier);
    }

    @Test
    @DisplayName("Unknown subscription type is a bad request")
    void unknownSubscriptionType() {
        when(terminalRepository.findById(5L)).thenReturn(Optional.of(TerminalFixtures.processingTerminal()));

        assertThrows(IllegalArgumentException.class, () -> handler.handle(5L, request(99), TerminalFixtures.ADMIN));
        verify(activationLogWriter, never()).append(any(), anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("Retired subscription type cannot be used for activation")
    void inactiveSubscriptionType() {
        Terminal terminal = TerminalFixtures.processingTerminal();
        SubscriptionType retired = mock(SubscriptionType.class);
        when(retired.isActive()).thenReturn(false);
        when(subscriptionTypeRepository.findById(7)).thenReturn(Optional.of(retired));
        when(terminalRepository.findById(5L)).thenReturn(Optional.of(terminal));

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> handler.handle(5L, request(7), TerminalFixtures.ADMIN));

        assertEquals("Invalid subscription type: 7", ex.getMessage());
        assertEquals(TerminalStatus.PROCESSING_FOR_ACTIVATION, terminal.getStatus());
        verifyNoInteractions(activationLogWriter, notifier);
    }

    @Test
    @DisplayName("Rejected terminal cannot be activated")
    void rejectedTerminal() {
        Terminal terminal = TerminalFixtures.processingTerminal();
        terminal.changeStatus(TerminalStatus.REJECTED, Instant.now());
        when(terminalRepository.findById(5L)).thenReturn(Optional.of(terminal));

        assertThrows(IllegalStateException.class, () -> handler.handle(5L, request(2), TerminalFixtures.ADMIN));
        verifyNoInteractions(activationLogWriter, notifier);
    }

    @Test
    @DisplayName("Re-activating an active terminal is logged as a renewal")
    void renewalDescription() {
        Terminal terminal = TerminalFixtures.activeTerminal();
        when(terminalRepository.findById(5L)).thenReturn(Optional.of(terminal));

        handler.handle(5L, new ActivateTerminalRequest(LocalDate.of(2026, 1, 1), 2, null, null),
                TerminalFixtures.ADMIN);

        ArgumentCaptor<String> description = ArgumentCaptor.forClass(String.class);
        verify(activationLogWriter).append(eq(terminal), eq(ActivationLog.ACTIVATED), description.capture(),
                eq("user_admin"));
        assertTrue(description.getValue().startsWith("Terminal subscription renewed"));
        assertEquals(LocalDate.of(2027, 1, 1), terminal.getActivationEndDate());
    }
}
