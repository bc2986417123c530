package com.portray.portal.features.contacts.api.dto;

import com.portray.portal.features.contacts.domain.ContactStatus;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ContactRequest(
    @NotNull Long portId,
    @NotBlank String contactName,
    @NotBlank String designation,
    @NotBlank @Email String email,
    @NotBlank String mobileNumber,
    ContactStatus status
) {}
