package com.portray.portal.features.terminals.app;

import com.portray.portal.common.exception.NotFoundException;
import com.portray.portal.common.outbox.OutboxService;
import com.portray.portal.common.security.UserPrincipal;
import com.portray.portal.features.terminals.api.dto.ActivateTerminalRequest;
import com.portray.portal.features.terminals.api.dto.TerminalView;
import com.portray.portal.features.terminals.domain.ActivationLog;
import com.portray.portal.features.terminals.domain.SubscriptionType;
import com.portray.portal.features.terminals.domain.SubscriptionTypeRepository;
import com.portray.portal.features.terminals.domain.Terminal;
import com.portray.portal.features.terminals.domain.TerminalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * SystemAdmin-only activation (or renewal) of a terminal's subscription window.
 */
@Service
public class ActivateTerminalHandler {

    private static final Logger log = LoggerFactory.getLogger(ActivateTerminalHandler.class);

    private final TerminalRepository terminalRepository;
    private final SubscriptionTypeRepository subscriptionTypeRepository;
    private final OutboxService outboxService;
    private final ActivationLogWriter activationLogWriter;
    private final TerminalNotifier notifier;
    private final Clock clock;

    public ActivateTerminalHandler(
            TerminalRepository terminalRepository,
            SubscriptionTypeRepository subscriptionTypeRepository,
            OutboxService outboxService,
            ActivationLogWriter activationLogWriter,
            TerminalNotifier notifier,
            Clock clock) {
        this.terminalRepository = terminalRepository;
        this.subscriptionTypeRepository = subscriptionTypeRepository;
        this.outboxService = outboxService;
        this.activationLogWriter = activationLogWriter;
        this.notifier = notifier;
        this.clock = clock;
    }

    @Transactional
    public TerminalView handle(Long terminalId, ActivateTerminalRequest request, UserPrincipal principal) {
        if (!principal.isSystemAdmin()) {
            log.warn("User {} attempted to activate terminal {}", principal.getUserId(), terminalId);
            throw new AccessDeniedException("Only SystemAdmin can activate terminals");
        }

        Terminal terminal = terminalRepository.findById(terminalId)
                .orElseThrow(() -> new NotFoundException("Terminal not found: " + terminalId));
        SubscriptionType subscriptionType = subscriptionTypeRepository.findById(request.subscriptionTypeId())
                .filter(SubscriptionType::isActive)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid subscription type: " + request.subscriptionTypeId()));

        boolean renewal = terminal.activate(subscriptionType, request.activationStartDate(),
                request.workOrderNo(), request.workOrderDate(), clock.instant());
        terminalRepository.save(terminal);
        outboxService.publishPending(terminal, "Terminal");

        activationLogWriter.append(terminal, ActivationLog.ACTIVATED, describe(terminal, subscriptionType, renewal),
                principal.getUserId());
        notifier.approved(terminal);

        log.info("Terminal {} {} until {} by {}", terminalId, renewal ? "renewed" : "activated",
                terminal.getActivationEndDate(), principal.getUserId());
        return TerminalView.from(terminal);
    }

    static String describe(Terminal terminal, SubscriptionType subscriptionType, boolean renewal) {
        StringBuilder description = new StringBuilder()
                .append(renewal ? "Terminal subscription renewed" : "Terminal activated")
                .append(" with ").append(subscriptionType.getMonths()).append(" month(s) subscription")
                .append(" (").append(subscriptionType.getName()).append(")")
                .append(" from ").append(terminal.getActivationStartDate())
                .append(" to ").append(terminal.getActivationEndDate());
        if (terminal.getWorkOrderNo() != null) {
            description.append(", work order ").append(terminal.getWorkOrderNo());
            if (terminal.getWorkOrderDate() != null) {
                description.append(" dated ").append(terminal.getWorkOrderDate());
            }
        }
        return description.toString();
    }
}
