package com.portray.portal.features.users.api.dto;

import com.portray.portal.common.security.UserRole;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record CreateUserRequest(
    @NotBlank @Email
    String email,

    @NotBlank @Size(min = 8, message = "Password must be at least 8 characters long")
    String password,

    @NotBlank
    String firstName,

    @NotBlank
    String lastName,

    @NotNull
    UserRole role,

    String userType,
    Long portId,
    List<Long> terminalIds
) {}
