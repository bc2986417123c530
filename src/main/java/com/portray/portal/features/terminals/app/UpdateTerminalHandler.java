package com.portray.portal.features.terminals.app;

import com.portray.portal.common.exception.ConflictException;
import com.portray.portal.common.exception.NotFoundException;
import com.portray.portal.common.outbox.OutboxService;
import com.portray.portal.common.security.UserPrincipal;
import com.portray.portal.features.terminals.api.dto.TerminalView;
import com.portray.portal.features.terminals.api.dto.UpdateTerminalRequest;
import com.portray.portal.features.terminals.domain.ActivationLog;
import com.portray.portal.features.terminals.domain.SubscriptionType;
import com.portray.portal.features.terminals.domain.SubscriptionTypeRepository;
import com.portray.portal.features.terminals.domain.Terminal;
import com.portray.portal.features.terminals.domain.TerminalChanges;
import com.portray.portal.features.terminals.domain.TerminalRepository;
import com.portray.portal.features.terminals.domain.TerminalStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * General terminal edit. An active terminal takes only profile fields; anything else in the
 * request is dropped without error, logged and named in the activation log.
 */
@Service
public class UpdateTerminalHandler {

    private static final Logger log = LoggerFactory.getLogger(UpdateTerminalHandler.class);

    private final TerminalRepository terminalRepository;
    private final SubscriptionTypeRepository subscriptionTypeRepository;
    private final OutboxService outboxService;
    private final ActivationLogWriter activationLogWriter;
    private final TerminalNotifier notifier;
    private final Clock clock;

    public UpdateTerminalHandler(
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
    public TerminalView handle(Long terminalId, UpdateTerminalRequest request, UserPrincipal principal) {
        Terminal terminal = terminalRepository.findById(terminalId)
                .orElseThrow(() -> new NotFoundException("Terminal not found: " + terminalId));

        TerminalStatus requestedStatus = request.status() != null ? TerminalStatus.fromLabel(request.status()) : null;
        boolean wasActive = terminal.getStatus() == TerminalStatus.ACTIVE;
        if (!wasActive && requestedStatus != null && requestedStatus != TerminalStatus.PROCESSING_FOR_ACTIVATION
                && !principal.isSystemAdmin()) {
            throw new AccessDeniedException("Only SystemAdmin can set terminal status to " + requestedStatus.getLabel());
        }

        String shortCode = request.shortCode() != null ? request.shortCode().trim() : null;
        if (shortCode != null && !shortCode.equals(terminal.getShortCode())
                && terminalRepository.existsByShortCode(shortCode)) {
            throw new ConflictException("Short code already exists");
        }

        if (!wasActive && request.subscriptionTypeId() != null) {
            subscriptionTypeRepository.findById(request.subscriptionTypeId())
                    .filter(SubscriptionType::isActive)
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Invalid subscription type: " + request.subscriptionTypeId()));
        }

        TerminalChanges changes = new TerminalChanges(request.toProfile(), requestedStatus,
                request.subscriptionTypeId(), request.activationStartDate(),
                request.workOrderNo(), request.workOrderDate());
        List<String> dropped = terminal.applyChanges(changes);
        if (!wasActive && requestedStatus != null) {
            terminal.changeStatus(requestedStatus, clock.instant());
        }
        terminalRepository.save(terminal);
        outboxService.publishPending(terminal, "Terminal");

        if (!dropped.isEmpty()) {
            log.warn("Ignored fields {} in update of active terminal {}", dropped, terminalId);
        }
        activationLogWriter.append(terminal, ActivationLog.UPDATED,
                describe(terminal, request, wasActive, dropped), principal.getUserId());

        if (!wasActive && requestedStatus == TerminalStatus.PROCESSING_FOR_ACTIVATION) {
            notifier.activationRequested(terminal);
        } else if (!wasActive && requestedStatus == TerminalStatus.REJECTED) {
            notifier.rejected(terminal);
        }
        return TerminalView.from(terminal);
    }

    static String describe(Terminal terminal, UpdateTerminalRequest request, boolean wasActive, List<String> dropped) {
        List<String> applied = new ArrayList<>(request.profileFieldsSupplied());
        String name = "Terminal '" + terminal.getTerminalName() + "'";

        if (wasActive) {
            StringBuilder description = new StringBuilder(name)
                    .append(" updated while Active; only profile fields can change");
            description.append(applied.isEmpty() ? " (none supplied)" : ": " + String.join(", ", applied));
            if (!dropped.isEmpty()) {
                description.append("; ignored ").append(String.join(", ", dropped));
            }
            return description.toString();
        }

        applied.addAll(new TerminalChanges(null, null, request.subscriptionTypeId(),
                request.activationStartDate(), request.workOrderNo(), request.workOrderDate()).restrictedFields());
        if (request.status() != null) {
            applied.add("status -> " + terminal.getStatus().getLabel());
        }
        return name + " updated" + (applied.isEmpty() ? "" : ": " + String.join(", ", applied));
    }
}
