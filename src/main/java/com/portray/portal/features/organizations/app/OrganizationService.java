package com.portray.portal.features.organizations.app;

import com.portray.portal.common.exception.ConflictException;
import com.portray.portal.common.exception.NotFoundException;
import com.portray.portal.features.organizations.api.dto.OrganizationRequest;
import com.portray.portal.features.organizations.api.dto.OrganizationView;
import com.portray.portal.features.organizations.api.dto.UpdateOrganizationRequest;
import com.portray.portal.features.organizations.domain.Organization;
import com.portray.portal.features.organizations.domain.OrganizationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class OrganizationService {

    private static final Logger log = LoggerFactory.getLogger(OrganizationService.class);

    private final OrganizationRepository organizationRepository;

    public OrganizationService(OrganizationRepository organizationRepository) {
        this.organizationRepository = organizationRepository;
    }

    @Transactional(readOnly = true)
    public List<OrganizationView> list() {
        return organizationRepository.findAllByOrderByOrganizationNameAsc().stream()
                .map(OrganizationView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public OrganizationView get(Long id) {
        return OrganizationView.from(load(id));
    }

    @Transactional
    public OrganizationView create(OrganizationRequest request) {
        checkUnique(null, request.organizationName(), request.displayName(), request.organizationCode());

        Organization org = new Organization(
                request.organizationName().trim(),
                request.displayName().trim(),
                request.organizationCode().trim(),
                request.registerOffice(),
                request.country());
        org.updateDetails(request.registerOffice(), request.country(), request.telephone(),
                request.fax(), request.website(), request.logoUrl());
        organizationRepository.save(org);

        log.info("Organization {} created ({})", org.getId(), org.getOrganizationCode());
        return OrganizationView.from(org);
    }

    @Transactional
    public OrganizationView update(Long id, UpdateOrganizationRequest request) {
        Organization org = load(id);
        checkUnique(org, request.organizationName(), request.displayName(), request.organizationCode());

        org.rename(
                orElse(request.organizationName(), org.getOrganizationName()),
                orElse(request.displayName(), org.getDisplayName()),
                orElse(request.organizationCode(), org.getOrganizationCode()));
        org.updateDetails(
                orElse(request.registerOffice(), org.getRegisterOffice()),
                orElse(request.country(), org.getCountry()),
                orElse(request.telephone(), org.getTelephone()),
                orElse(request.fax(), org.getFax()),
                orElse(request.website(), org.getWebsite()),
                orElse(request.logoUrl(), org.getLogoUrl()));
        organizationRepository.save(org);
        return OrganizationView.from(org);
    }

    @Transactional
    public OrganizationView toggleStatus(Long id) {
        Organization org = load(id);
        org.toggleActive();
        organizationRepository.save(org);
        log.info("Organization {} is now {}", id, org.isActive() ? "active" : "inactive");
        return OrganizationView.from(org);
    }

    @Transactional(readOnly = true)
    public void requireExists(Long id) {
        if (id == null || !organizationRepository.existsById(id)) {
            throw new NotFoundException("Organization not found: " + id);
        }
    }

    private Organization load(Long id) {
        return organizationRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Organization not found: " + id));
    }

    /**
     * Name, display name and code are each unique. Unchanged values of {@code current} are not re-checked.
     */
    private void checkUnique(Organization current, String name, String displayName, String code) {
        if (name != null && (current == null || !name.equals(current.getOrganizationName()))
                && organizationRepository.existsByOrganizationName(name.trim())) {
            throw new ConflictException("Organization name already exists");
        }
        if (displayName != null && (current == null || !displayName.equals(current.getDisplayName()))
                && organizationRepository.existsByDisplayName(displayName.trim())) {
            throw new ConflictException("Display name already exists");
        }
        if (code != null && (current == null || !code.equals(current.getOrganizationCode()))
                && organizationRepository.existsByOrganizationCode(code.trim())) {
            throw new ConflictException("Organization code already exists");
        }
    }

    private static String orElse(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
