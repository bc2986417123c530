package com.portray.portal.features.ports.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record PortRequest(
    @NotBlank String portName,

    @NotBlank @Size(max = 6, message = "Display name must be at most 6 characters")
    String displayName,

    @NotNull Long organizationId,
    @NotBlank String address,
    @NotBlank String country,
    @NotBlank String state
) {}
