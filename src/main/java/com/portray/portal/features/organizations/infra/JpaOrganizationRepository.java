package com.portray.portal.features.organizations.infra;

import com.portray.portal.features.organizations.domain.Organization;
import com.portray.portal.features.organizations.domain.OrganizationRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JpaOrganizationRepository extends JpaRepository<Organization, Long>, OrganizationRepository {

    @Override
    List<Organization> findAllByOrderByOrganizationNameAsc();

    @Override
    boolean existsByOrganizationName(String organizationName);

    @Override
    boolean existsByDisplayName(String displayName);

    @Override
    boolean existsByOrganizationCode(String organizationCode);
}
