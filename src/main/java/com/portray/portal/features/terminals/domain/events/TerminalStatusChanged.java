package com.portray.portal.features.terminals.domain.events;

import com.portray.portal.common.domain.DomainEvent;
import com.portray.portal.features.terminals.domain.TerminalStatus;

import java.time.Instant;

public record TerminalStatusChanged(
    Long terminalId,
    TerminalStatus previousStatus,
    TerminalStatus status,
    Instant occurredOn
) implements DomainEvent {

    @Override
    public String aggregateId() {
        return String.valueOf(terminalId);
    }
}
