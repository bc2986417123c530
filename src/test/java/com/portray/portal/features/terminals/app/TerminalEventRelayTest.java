package com.portray.portal.features.terminals.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portray.portal.common.outbox.OutboxEvent;
import com.portray.portal.common.outbox.OutboxEventRepository;
import com.portray.portal.features.terminals.api.dto.TerminalEventMessage;
import com.portray.portal.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class TerminalEventRelayTest {

    private static final Instant CREATED = Instant.parse("2025-05-05T10:00:00Z");
    private static final Instant NOW = Instant.parse("2025-05-05T10:00:03Z");

    private OutboxEventRepository outboxRepository;
    private SimpMessagingTemplate messagingTemplate;
    private TerminalEventRelay relay;

    @BeforeEach
    void setUp() {
        outboxRepository = mock(OutboxEventRepository.class);
        messagingTemplate = mock(SimpMessagingTemplate.class);
        relay = new TerminalEventRelay(outboxRepository, messagingTemplate, new ObjectMapper(),
                new MutableClock(NOW), 3);
    }

    private static OutboxEvent event(String id, long terminalId) {
        return new OutboxEvent(id, "Terminal", String.valueOf(terminalId), "TerminalSubmitted",
                "{\"terminalId\":" + terminalId + "}", CREATED);
    }

    @Test
    @DisplayName("Delivered events go to the terminals topic and are marked with the clock time")
    void marksDelivered() {
        OutboxEvent submitted = event("evt_1", 42L);
        when(outboxRepository.findDeliverable("Terminal", 3, 100)).thenReturn(List.of(submitted));

        relay.relay();

        ArgumentCaptor<TerminalEventMessage> message = ArgumentCaptor.forClass(TerminalEventMessage.class);
        verify(messagingTemplate).convertAndSend(eq("/topic/terminals"), message.capture());
        assertEquals(42L, message.getValue().terminalId());
        assertEquals(42, message.getValue().payload().get("terminalId").asInt());
        assertEquals(NOW, submitted.getProcessedAt());
        verify(outboxRepository).save(submitted);
    }

    @Test
    @DisplayName("A failed hand-off stays pending with the attempt counted; later events still go out")
    void countsFailures() {
        OutboxEvent failing = event("evt_1", 1L);
        OutboxEvent next = event("evt_2", 2L);
        when(outboxRepository.findDeliverable("Terminal", 3, 100)).thenReturn(List.of(failing, next));
        doThrow(new MessageDeliveryException("broker unavailable"))
                .doNothing()
                .when(messagingTemplate).convertAndSend(eq("/topic/terminals"), any(Object.class));

        relay.relay();

        assertFalse(failing.isProcessed());
        assertEquals(1, failing.getAttempts());
        assertEquals("broker unavailable", failing.getLastError());
        assertTrue(next.isProcessed());
        verify(outboxRepository).save(failing);
        verify(outboxRepository).save(next);
    }
}
