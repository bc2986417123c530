package com.portray.portal.features.passwordsetup.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SetupPasswordRequest(
    @NotBlank String userId,

    @NotBlank @Size(min = 8, message = "Password must be at least 8 characters long")
    String password,

    @NotBlank(message = "Setup token is required")
    String setupToken
) {}
