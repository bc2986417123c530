package com.portray.portal.features.terminals.domain;

import java.util.List;

public interface ActivationLogRepository {
    ActivationLog save(ActivationLog log);
    List<ActivationLog> findByTerminalIdOrderByCreatedAtDesc(Long terminalId);
    long countByTerminalIdAndAction(Long terminalId, String action);
}
