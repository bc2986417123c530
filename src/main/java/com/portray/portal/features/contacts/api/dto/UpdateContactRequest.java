package com.portray.portal.features.contacts.api.dto;

import com.portray.portal.features.contacts.domain.ContactStatus;
import jakarta.validation.constraints.Email;

/**
 * Partial update; null fields keep their current value.
 */
public record UpdateContactRequest(
    String contactName,
    String designation,
    @Email String email,
    String mobileNumber,
    ContactStatus status
) {}
