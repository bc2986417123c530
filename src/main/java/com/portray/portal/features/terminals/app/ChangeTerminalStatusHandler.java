package com.portray.portal.features.terminals.app;

import com.portray.portal.common.exception.NotFoundException;
import com.portray.portal.common.outbox.OutboxService;
import com.portray.portal.common.security.UserPrincipal;
import com.portray.portal.features.terminals.api.dto.TerminalView;
import com.portray.portal.features.terminals.domain.ActivationLog;
import com.portray.portal.features.terminals.domain.Terminal;
import com.portray.portal.features.terminals.domain.TerminalRepository;
import com.portray.portal.features.terminals.domain.TerminalStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * SystemAdmin status override, used to reject a terminal or send it back for review.
 */
@Service
public class ChangeTerminalStatusHandler {

    private static final Logger log = LoggerFactory.getLogger(ChangeTerminalStatusHandler.class);

    private final TerminalRepository terminalRepository;
    private final OutboxService outboxService;
    private final ActivationLogWriter activationLogWriter;
    private final TerminalNotifier notifier;
    private final Clock clock;

    public ChangeTerminalStatusHandler(
            TerminalRepository terminalRepository,
            OutboxService outboxService,
            ActivationLogWriter activationLogWriter,
            TerminalNotifier notifier,
            Clock clock) {
        this.terminalRepository = terminalRepository;
        this.outboxService = outboxService;
        this.activationLogWriter = activationLogWriter;
        this.notifier = notifier;
        this.clock = clock;
    }

    @Transactional
    public TerminalView handle(Long terminalId, String statusLabel, UserPrincipal principal) {
        if (!principal.isSystemAdmin()) {
            throw new AccessDeniedException("Only SystemAdmin can change terminal status");
        }
        TerminalStatus status = TerminalStatus.fromLabel(statusLabel);

        Terminal terminal = terminalRepository.findById(terminalId)
                .orElseThrow(() -> new NotFoundException("Terminal not found: " + terminalId));
        TerminalStatus previous = terminal.getStatus();

        terminal.changeStatus(status, clock.instant());
        terminalRepository.save(terminal);
        outboxService.publishPending(terminal, "Terminal");

        activationLogWriter.append(terminal, ActivationLog.STATUS_CHANGED,
                "Status changed from " + previous.getLabel() + " to " + status.getLabel(),
                principal.getUserId());
        if (status == TerminalStatus.REJECTED && previous != TerminalStatus.REJECTED) {
            notifier.rejected(terminal);
        }

        log.info("Terminal {} status {} -> {} by {}", terminalId, previous.getLabel(), status.getLabel(),
                principal.getUserId());
        return TerminalView.from(terminal);
    }
}
