package com.portray.portal.features.terminals.app;

import com.portray.portal.common.exception.NotFoundException;
import com.portray.portal.common.security.UserPrincipal;
import com.portray.portal.features.terminals.domain.Terminal;
import com.portray.portal.features.terminals.domain.TerminalRepository;
import com.portray.portal.features.terminals.domain.TerminalStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class DeleteTerminalHandler {

    private static final Logger log = LoggerFactory.getLogger(DeleteTerminalHandler.class);

    private final TerminalRepository terminalRepository;

    public DeleteTerminalHandler(TerminalRepository terminalRepository) {
        this.terminalRepository = terminalRepository;
    }

    @Transactional
    public void handle(Long terminalId, UserPrincipal principal) {
        if (!principal.isSystemAdmin()) {
            throw new AccessDeniedException("Only SystemAdmin can delete terminals");
        }
        Terminal terminal = terminalRepository.findById(terminalId)
                .orElseThrow(() -> new NotFoundException("Terminal not found: " + terminalId));
        if (terminal.getStatus() == TerminalStatus.ACTIVE) {
            throw new IllegalStateException("An active terminal cannot be deleted");
        }

        terminalRepository.delete(terminal);
        log.info("Terminal {} deleted by {}", terminalId, principal.getUserId());
    }
}
