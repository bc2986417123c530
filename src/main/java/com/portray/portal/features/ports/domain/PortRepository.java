package com.portray.portal.features.ports.domain;

import java.util.List;
import java.util.Optional;

public interface PortRepository {
    Port save(Port port);
    Optional<Port> findById(Long id);
    boolean existsById(Long id);
    List<Port> findAllByOrderByPortNameAsc();
    List<Port> findByOrganizationIdOrderByPortNameAsc(Long organizationId);
}
