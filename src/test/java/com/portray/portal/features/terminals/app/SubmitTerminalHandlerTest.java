package com.portray.portal.features.terminals.app;

import com.portray.portal.common.exception.ConflictException;
import com.portray.portal.common.exception.NotFoundException;
import com.portray.portal.common.outbox.OutboxService;
import com.portray.portal.features.ports.app.PortService;
import com.portray.portal.features.terminals.TerminalFixtures;
import com.portray.portal.features.terminals.api.dto.CreateTerminalRequest;
import com.portray.portal.features.terminals.api.dto.TerminalView;
import com.portray.portal.features.terminals.domain.ActivationLog;
import com.portray.portal.features.terminals.domain.Terminal;
import com.portray.portal.features.terminals.domain.TerminalRepository;
import com.portray.portal.features.terminals.domain.TerminalStatus;
import com.portray.portal.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SubmitTerminalHandlerTest {

    private TerminalRepository terminalRepository;
    private PortService portService;
    private OutboxService outboxService;
    private ActivationLogWriter activationLogWriter;
    private TerminalNotifier notifier;
    private SubmitTerminalHandler handler;

    @BeforeEach
    void setUp() {
        terminalRepository = mock(TerminalRepository.class);
        portService = mock(PortService.class);
        outboxService = mock(OutboxService.class);
        activationLogWriter = mock(ActivationLogWriter.class);
        notifier = mock(TerminalNotifier.class);
        handler = new SubmitTerminalHandler(terminalRepository, portService, outboxService, activationLogWriter,
                notifier, new MutableClock(Instant.parse("2025-02-01T00:00:00Z")));
        when(terminalRepository.save(any(Terminal.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private static CreateTerminalRequest request(String shortCode) {
        return new CreateTerminalRequest("Liquid Berth", shortCode, null, null, null, "Asia/Kolkata",
                "Pier 9", "Kochi", "682001", "+91-484-5550101", null,
                null, null, null, null, null, true);
    }

    @Test
    @DisplayName("Submission creates a pending terminal, logs it and asks admins to review")
    void submits() {
        TerminalView view = handler.handle(3L, request("LQB"), TerminalFixtures.PORT_ADMIN);

        assertEquals(TerminalStatus.PROCESSING_FOR_ACTIVATION, view.status());
        assertEquals("Pier 9", view.shippingAddress());
        verify(activationLogWriter).append(any(Terminal.class), eq(ActivationLog.SUBMITTED), anyString(), eq("user_pa"));
        verify(notifier).activationRequested(any(Terminal.class));
        verify(outboxService).publishPending(any(Terminal.class), eq("Terminal"));
    }

    @Test
    @DisplayName("Duplicate short code is refused before anything is written")
    void duplicateShortCode() {
        when(terminalRepository.existsByShortCode("LQB")).thenReturn(true);

        assertThrows(ConflictException.class, () -> handler.handle(3L, request(" LQB "), TerminalFixtures.PORT_ADMIN));
        verify(terminalRepository, never()).save(any());
        verifyNoInteractions(activationLogWriter, notifier);
    }

    @Test
    @DisplayName("Unknown port is not found")
    void unknownPort() {
        doThrow(new NotFoundException("Port not found: 404")).when(portService).requireExists(404L);

        assertThrows(NotFoundException.class, () -> handler.handle(404L, request("LQB"), TerminalFixtures.PORT_ADMIN));
        verify(terminalRepository, never()).save(any());
    }
}
