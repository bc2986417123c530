package com.portray.portal.features.ports.app;

import com.portray.portal.common.exception.NotFoundException;
import com.portray.portal.features.organizations.app.OrganizationService;
import com.portray.portal.features.ports.api.dto.PortRequest;
import com.portray.portal.features.ports.api.dto.PortView;
import com.portray.portal.features.ports.domain.Port;
import com.portray.portal.features.ports.domain.PortRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class PortService {

    private static final Logger log = LoggerFactory.getLogger(PortService.class);

    private final PortRepository portRepository;
    private final OrganizationService organizationService;

    public PortService(PortRepository portRepository, OrganizationService organizationService) {
        this.portRepository = portRepository;
        this.organizationService = organizationService;
    }

    @Transactional(readOnly = true)
    public List<PortView> list() {
        return portRepository.findAllByOrderByPortNameAsc().stream()
                .map(PortView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<PortView> listByOrganization(Long organizationId) {
        organizationService.requireExists(organizationId);
        return portRepository.findByOrganizationIdOrderByPortNameAsc(organizationId).stream()
                .map(PortView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public PortView get(Long id) {
        return PortView.from(load(id));
    }

    @Transactional
    public PortView create(PortRequest request) {
        organizationService.requireExists(request.organizationId());

        Port port = new Port(
                request.portName().trim(),
                request.displayName().trim(),
                request.organizationId(),
                request.address(),
                request.country(),
                request.state());
        portRepository.save(port);

        log.info("Port {} created under organization {}", port.getId(), port.getOrganizationId());
        return PortView.from(port);
    }

    @Transactional
    public PortView update(Long id, PortRequest request) {
        Port port = load(id);
        if (!port.getOrganizationId().equals(request.organizationId())) {
            organizationService.requireExists(request.organizationId());
            port.moveTo(request.organizationId());
        }
        port.update(request.portName().trim(), request.displayName().trim(),
                request.address(), request.country(), request.state());
        portRepository.save(port);
        return PortView.from(port);
    }

    @Transactional
    public PortView toggleStatus(Long id) {
        Port port = load(id);
        port.toggleActive();
        portRepository.save(port);
        log.info("Port {} is now {}", id, port.isActive() ? "active" : "inactive");
        return PortView.from(port);
    }

    @Transactional(readOnly = true)
    public void requireExists(Long id) {
        if (id == null || !portRepository.existsById(id)) {
            throw new NotFoundException("Port not found: " + id);
        }
    }

    private Port load(Long id) {
        return portRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Port not found: " + id));
    }
}
