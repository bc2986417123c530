package com.portray.portal.common.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portray.portal.common.domain.AggregateRoot;
import com.portray.portal.common.domain.DomainEvent;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Writes domain events to the outbox in the caller's transaction, so an event exists exactly
 * when the change that raised it was committed.
 */
@Service
public class OutboxService {

    private final OutboxEventRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OutboxService(OutboxEventRepository outboxRepository, ObjectMapper objectMapper, Clock clock) {
        this.outboxRepository = outboxRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Transactional
    public OutboxEvent publish(DomainEvent event, String aggregateType) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event " + event.eventType(), e);
        }

        String eventId = "evt_" + UUID.randomUUID().toString().replace("-", "");
        return outboxRepository.save(new OutboxEvent(eventId, aggregateType, event.aggregateId(),
                event.eventType(), payload, clock.instant()));
    }

    /**
     * Drains the aggregate's recorded events into the outbox.
     */
    @Transactional
    public void publishPending(AggregateRoot<?> aggregate, String aggregateType) {
        for (DomainEvent event : aggregate.pullDomainEvents()) {
            publish(event, aggregateType);
        }
    }
}
