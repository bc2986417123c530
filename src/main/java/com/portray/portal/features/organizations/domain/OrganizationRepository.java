package com.portray.portal.features.organizations.domain;

import java.util.List;
import java.util.Optional;

public interface OrganizationRepository {
    Organization save(Organization organization);
    Optional<Organization> findById(Long id);
    boolean existsById(Long id);
    List<Organization> findAllByOrderByOrganizationNameAsc();
    boolean existsByOrganizationName(String organizationName);
    boolean existsByDisplayName(String displayName);
    boolean existsByOrganizationCode(String organizationCode);
}
