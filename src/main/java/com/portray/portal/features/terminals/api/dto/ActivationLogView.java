package com.portray.portal.features.terminals.api.dto;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.portray.portal.features.terminals.domain.ActivationLog;

import java.time.Instant;

public record ActivationLogView(
    Long id,
    Long terminalId,
    String action,
    String description,
    String performedBy,
    @JsonRawValue String data,
    Instant createdAt
) {
    public static ActivationLogView from(ActivationLog log) {
        return new ActivationLogView(log.getId(), log.getTerminalId(), log.getAction(), log.getDescription(),
                log.getPerformedBy(), log.getData(), log.getCreatedAt());
    }
}
