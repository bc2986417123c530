package com.portray.portal.features.organizations.api.dto;

/**
 * Partial update; null fields keep their current value.
 */
public record UpdateOrganizationRequest(
    String organizationName,
    String displayName,
    String organizationCode,
    String registerOffice,
    String country,
    String telephone,
    String fax,
    String website,
    String logoUrl
) {}
