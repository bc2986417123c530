package com.portray.portal.features.terminals.app;

import com.portray.portal.common.exception.ConflictException;
import com.portray.portal.common.outbox.OutboxService;
import com.portray.portal.common.security.UserPrincipal;
import com.portray.portal.features.ports.app.PortService;
import com.portray.portal.features.terminals.api.dto.CreateTerminalRequest;
import com.portray.portal.features.terminals.api.dto.TerminalView;
import com.portray.portal.features.terminals.domain.ActivationLog;
import com.portray.portal.features.terminals.domain.Terminal;
import com.portray.portal.features.terminals.domain.TerminalRepository;
import com.portray.portal.features.terminals.domain.TerminalStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Creates a terminal under a port in "Processing for activation" and asks the admins to review it.
 */
@Service
public class SubmitTerminalHandler {

    private static final Logger log = LoggerFactory.getLogger(SubmitTerminalHandler.class);

    private final TerminalRepository terminalRepository;
    private final PortService portService;
    private final OutboxService outboxService;
    private final ActivationLogWriter activationLogWriter;
    private final TerminalNotifier notifier;
    private final Clock clock;

    public SubmitTerminalHandler(
            TerminalRepository terminalRepository,
            PortService portService,
            OutboxService outboxService,
            ActivationLogWriter activationLogWriter,
            TerminalNotifier notifier,
            Clock clock) {
        this.terminalRepository = terminalRepository;
        this.portService = portService;
        this.outboxService = outboxService;
        this.activationLogWriter = activationLogWriter;
        this.notifier = notifier;
        this.clock = clock;
    }

    @Transactional
    public TerminalView handle(Long portId, CreateTerminalRequest request, UserPrincipal principal) {
        portService.requireExists(portId);
        if (terminalRepository.existsByShortCode(request.shortCode().trim())) {
            throw new ConflictException("Short code already exists");
        }

        Terminal terminal = terminalRepository.save(
                new Terminal(portId, request.toProfile(), principal.getUserId()));
        terminal.markSubmitted(clock.instant());
        outboxService.publishPending(terminal, "Terminal");

        activationLogWriter.append(terminal, ActivationLog.SUBMITTED,
                "Terminal '" + terminal.getTerminalName() + "' (" + terminal.getShortCode()
                        + ") submitted for activation with status " + terminal.getStatus().getLabel(),
                principal.getUserId());
        if (terminal.getStatus() == TerminalStatus.PROCESSING_FOR_ACTIVATION) {
            notifier.activationRequested(terminal);
        }

        log.info("Terminal {} submitted under port {} by {}", terminal.getId(), portId, principal.getUserId());
        return TerminalView.from(terminal);
    }
}
