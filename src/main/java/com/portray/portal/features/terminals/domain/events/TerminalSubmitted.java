package com.portray.portal.features.terminals.domain.events;

import com.portray.portal.common.domain.DomainEvent;

import java.time.Instant;

public record TerminalSubmitted(
    Long terminalId,
    Long portId,
    String terminalName,
    String shortCode,
    String createdBy,
    Instant occurredOn
) implements DomainEvent {

    @Override
    public String aggregateId() {
        return String.valueOf(terminalId);
    }
}
