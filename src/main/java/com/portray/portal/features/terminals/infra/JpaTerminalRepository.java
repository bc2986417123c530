package com.portray.portal.features.terminals.infra;

import com.portray.portal.features.terminals.domain.Terminal;
import com.portray.portal.features.terminals.domain.TerminalRepository;
import com.portray.portal.features.terminals.domain.TerminalStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JpaTerminalRepository extends JpaRepository<Terminal, Long>, TerminalRepository {

    @Override
    List<Terminal> findByPortIdOrderByCreatedAtDesc(Long portId);

    @Override
    List<Terminal> findByStatusOrderByCreatedAtAsc(TerminalStatus status);

    @Override
    boolean existsByShortCode(String shortCode);
}
