package com.portray.portal.features.terminals.app;

import com.portray.portal.common.exception.NotFoundException;
import com.portray.portal.features.ports.app.PortService;
import com.portray.portal.features.terminals.api.dto.ActivationLogView;
import com.portray.portal.features.terminals.api.dto.SubscriptionTypeView;
import com.portray.portal.features.terminals.api.dto.TerminalView;
import com.portray.portal.features.terminals.domain.ActivationLogRepository;
import com.portray.portal.features.terminals.domain.SubscriptionTypeRepository;
import com.portray.portal.features.terminals.domain.TerminalRepository;
import com.portray.portal.features.terminals.domain.TerminalStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Transactional(readOnly = true)
public class TerminalQueryService {

    private final TerminalRepository terminalRepository;
    private final ActivationLogRepository activationLogRepository;
    private final SubscriptionTypeRepository subscriptionTypeRepository;
    private final PortService portService;

    public TerminalQueryService(
            TerminalRepository terminalRepository,
            ActivationLogRepository activationLogRepository,
            SubscriptionTypeRepository subscriptionTypeRepository,
            PortService portService) {
        this.terminalRepository = terminalRepository;
        this.activationLogRepository = activationLogRepository;
        this.subscriptionTypeRepository = subscriptionTypeRepository;
        this.portService = portService;
    }

    public TerminalView get(Long id) {
        return terminalRepository.findById(id)
                .map(TerminalView::from)
                .orElseThrow(() -> new NotFoundException("Terminal not found: " + id));
    }

    public List<TerminalView> listByPort(Long portId) {
        portService.requireExists(portId);
        return terminalRepository.findByPortIdOrderByCreatedAtDesc(portId).stream()
                .map(TerminalView::from)
                .toList();
    }

    public List<TerminalView> pendingActivation() {
        return terminalRepository.findByStatusOrderByCreatedAtAsc(TerminalStatus.PROCESSING_FOR_ACTIVATION).stream()
                .map(TerminalView::from)
                .toList();
    }

    public List<ActivationLogView> activationLog(Long terminalId) {
        if (terminalRepository.findById(terminalId).isEmpty()) {
            throw new NotFoundException("Terminal not found: " + terminalId);
        }
        return activationLogRepository.findByTerminalIdOrderByCreatedAtDesc(terminalId).stream()
                .map(ActivationLogView::from)
                .toList();
    }

    public List<SubscriptionTypeView> subscriptionTypes() {
        return subscriptionTypeRepository.findByActiveTrueOrderByMonthsAsc().stream()
                .map(SubscriptionTypeView::from)
                .toList();
    }
}
