package com.portray.portal.common.domain;

import java.time.Instant;

/**
 * Something that happened to an aggregate. Implemented by records whose components form the
 * outbox payload.
 */
public interface DomainEvent {

    String aggregateId();

    Instant occurredOn();

    default String eventType() {
        return getClass().getSimpleName();
    }
}
