package com.portray.portal.common.domain;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An entity that records domain events while it changes. The events stay on the aggregate
 * until the handler that saved it drains them into the outbox.
 */
public abstract class AggregateRoot<ID extends Serializable> extends Entity<ID> {

    private final transient List<DomainEvent> pendingEvents = new ArrayList<>();

    protected void registerEvent(DomainEvent event) {
        pendingEvents.add(event);
    }

    public List<DomainEvent> getDomainEvents() {
        return Collections.unmodifiableList(pendingEvents);
    }

    /**
     * Returns the recorded events in order and forgets them.
     */
    public List<DomainEvent> pullDomainEvents() {
        List<DomainEvent> events = List.copyOf(pendingEvents);
        pendingEvents.clear();
        return events;
    }
}
