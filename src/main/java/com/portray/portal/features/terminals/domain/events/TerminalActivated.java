package com.portray.portal.features.terminals.domain.events;

import com.portray.portal.common.domain.DomainEvent;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Published on activation and on renewal of an already active terminal.
 */
public record TerminalActivated(
    Long terminalId,
    Integer subscriptionTypeId,
    int months,
    LocalDate activationStartDate,
    LocalDate activationEndDate,
    boolean renewal,
    Instant occurredOn
) implements DomainEvent {

    @Override
    public String aggregateId() {
        return String.valueOf(terminalId);
    }
}
