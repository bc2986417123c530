package com.portray.portal.features.terminals.infra;

import com.portray.portal.features.terminals.domain.ActivationLog;
import com.portray.portal.features.terminals.domain.ActivationLogRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JpaActivationLogRepository extends JpaRepository<ActivationLog, Long>, ActivationLogRepository {

    @Override
    List<ActivationLog> findByTerminalIdOrderByCreatedAtDesc(Long terminalId);

    @Override
    long countByTerminalIdAndAction(Long terminalId, String action);
}
