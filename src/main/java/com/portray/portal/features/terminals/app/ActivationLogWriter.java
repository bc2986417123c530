package com.portray.portal.features.terminals.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portray.portal.common.tx.SideEffectExecutor;
import com.portray.portal.features.terminals.api.dto.TerminalView;
import com.portray.portal.features.terminals.domain.ActivationLog;
import com.portray.portal.features.terminals.domain.ActivationLogRepository;
import com.portray.portal.features.terminals.domain.Terminal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Appends activation log entries with a snapshot of the terminal. Never throws.
 */
@Component
public class ActivationLogWriter {

    private static final Logger log = LoggerFactory.getLogger(ActivationLogWriter.class);

    private final ActivationLogRepository activationLogRepository;
    private final SideEffectExecutor sideEffects;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ActivationLogWriter(
            ActivationLogRepository activationLogRepository,
            SideEffectExecutor sideEffects,
            ObjectMapper objectMapper,
            Clock clock) {
        this.activationLogRepository = activationLogRepository;
        this.sideEffects = sideEffects;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void append(Terminal terminal, String action, String description, String performedBy) {
        try {
            ActivationLog entry = new ActivationLog(
                    terminal.getId(),
                    action,
                    description,
                    performedBy,
                    objectMapper.writeValueAsString(TerminalView.from(terminal)),
                    clock.instant());
            sideEffects.afterCommit("append " + action + " log for terminal " + terminal.getId(),
                    () -> activationLogRepository.save(entry));
        } catch (Exception e) {
            log.error("Failed to append {} log for terminal {}", action, terminal.getId(), e);
        }
    }
}
