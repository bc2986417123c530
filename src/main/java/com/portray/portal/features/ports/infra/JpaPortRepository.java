package com.portray.portal.features.ports.infra;

import com.portray.portal.features.ports.domain.Port;
import com.portray.portal.features.ports.domain.PortRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JpaPortRepository extends JpaRepository<Port, Long>, PortRepository {

    @Override
    List<Port> findAllByOrderByPortNameAsc();

    @Override
    List<Port> findByOrganizationIdOrderByPortNameAsc(Long organizationId);
}
