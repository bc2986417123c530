package com.portray.portal.features.terminals.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portray.portal.common.outbox.OutboxEvent;
import com.portray.portal.common.outbox.OutboxEventRepository;
import com.portray.portal.features.terminals.api.dto.TerminalEventMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Relays terminal lifecycle events from the outbox to /topic/terminals.
 * An event is marked processed only once it has been handed to the broker; a failed hand-off
 * is counted and retried on the next run until the attempts run out.
 */
@Service
public class TerminalEventRelay {

    private static final Logger log = LoggerFactory.getLogger(TerminalEventRelay.class);
    static final String DESTINATION = "/topic/terminals";
    static final String AGGREGATE_TYPE = "Terminal";
    private static final int BATCH_SIZE = 100;

    private final OutboxEventRepository outboxRepository;
    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int maxAttempts;

    public TerminalEventRelay(
            OutboxEventRepository outboxRepository,
            SimpMessagingTemplate messagingTemplate,
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${app.portal.outbox.max-attempts:10}") int maxAttempts) {
        this.outboxRepository = outboxRepository;
        this.messagingTemplate = messagingTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
    }

    @Scheduled(fixedDelayString = "${app.portal.outbox.relay-interval-ms:2000}")
    @Transactional
    public void relay() {
        List<OutboxEvent> events = outboxRepository.findDeliverable(AGGREGATE_TYPE, maxAttempts, BATCH_SIZE);
        if (events.isEmpty()) {
            return;
        }

        log.debug("Relaying {} terminal events", events.size());
        for (OutboxEvent event : events) {
            try {
                messagingTemplate.convertAndSend(DESTINATION, toMessage(event));
                event.markProcessed(clock.instant());
            } catch (Exception e) {
                event.recordFailure(e.getMessage());
                if (event.getAttempts() >= maxAttempts) {
                    log.error("Giving up on outbox event {} after {} attempts", event.getEventId(),
                            event.getAttempts(), e);
                } else {
                    log.warn("Failed to relay outbox event {} (attempt {})", event.getEventId(),
                            event.getAttempts(), e);
                }
            }
            outboxRepository.save(event);
        }
    }

    private TerminalEventMessage toMessage(OutboxEvent event) throws JsonProcessingException {
        return new TerminalEventMessage(
                event.getEventId(),
                event.getEventType(),
                Long.valueOf(event.getAggregateId()),
                objectMapper.readTree(event.getPayload()),
                event.getCreatedAt());
    }
}
