package com.portray.portal.features.terminals.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Frame sent to /topic/terminals for each lifecycle event.
 */
public record TerminalEventMessage(
    String eventId,
    String eventType,
    Long terminalId,
    JsonNode payload,
    Instant occurredOn
) {}
