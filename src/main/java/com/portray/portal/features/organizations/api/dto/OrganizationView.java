package com.portray.portal.features.organizations.api.dto;

import com.portray.portal.features.organizations.domain.Organization;

import java.time.Instant;

public record OrganizationView(
    Long id,
    String organizationName,
    String displayName,
    String organizationCode,
    String registerOffice,
    String country,
    String telephone,
    String fax,
    String website,
    String logoUrl,
    boolean isActive,
    Instant createdAt,
    Instant updatedAt
) {
    public static OrganizationView from(Organization org) {
        return new OrganizationView(
            org.getId(),
            org.getOrganizationName(),
            org.getDisplayName(),
            org.getOrganizationCode(),
            org.getRegisterOffice(),
            org.getCountry(),
            org.getTelephone(),
            org.getFax(),
            org.getWebsite(),
            org.getLogoUrl(),
            org.isActive(),
            org.getCreatedAt(),
            org.getUpdatedAt()
        );
    }
}
