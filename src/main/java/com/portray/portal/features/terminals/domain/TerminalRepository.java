package com.portray.portal.features.terminals.domain;

import java.util.List;
import java.util.Optional;

public interface TerminalRepository {
    Terminal save(Terminal terminal);
    Optional<Terminal> findById(Long id);
    List<Terminal> findByPortIdOrderByCreatedAtDesc(Long portId);
    List<Terminal> findByStatusOrderByCreatedAtAsc(TerminalStatus status);
    boolean existsByShortCode(String shortCode);
    void delete(Terminal terminal);
}
