package com.portray.portal.features.users.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Partial update; null fields keep their current value.
 */
public record UpdateUserRequest(
    @Email
    String email,

    @Size(min = 8, message = "Password must be at least 8 characters long")
    String password,

    String firstName,
    String lastName,
    String userType,
    Long portId,
    List<Long> terminalIds
) {}
