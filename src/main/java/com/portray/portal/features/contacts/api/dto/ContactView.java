package com.portray.portal.features.contacts.api.dto;

import com.portray.portal.features.contacts.domain.ContactStatus;
import com.portray.portal.features.contacts.domain.PortAdminContact;

import java.time.Instant;

public record ContactView(
    Long id,
    Long portId,
    String contactName,
    String designation,
    String email,
    String mobileNumber,
    ContactStatus status,
    boolean isVerified,
    Instant verificationTokenExpires,
    String userId,
    Instant createdAt,
    Instant updatedAt
) {
    public static ContactView from(PortAdminContact contact) {
        return new ContactView(
            contact.getId(),
            contact.getPortId(),
            contact.getContactName(),
            contact.getDesignation(),
            contact.getEmail(),
            contact.getMobileNumber(),
            contact.getStatus(),
            contact.isVerified(),
            contact.getVerificationTokenExpires(),
            contact.getUserId(),
            contact.getCreatedAt(),
            contact.getUpdatedAt()
        );
    }
}
