package com.portray.portal.features.organizations.api.dto;

import jakarta.validation.constraints.NotBlank;

public record OrganizationRequest(
    @NotBlank String organizationName,
    @NotBlank String displayName,
    @NotBlank String organizationCode,
    @NotBlank String registerOffice,
    @NotBlank String country,
    String telephone,
    String fax,
    String website,
    String logoUrl
) {}
