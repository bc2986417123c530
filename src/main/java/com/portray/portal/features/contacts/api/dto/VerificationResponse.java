package com.portray.portal.features.contacts.api.dto;

public record VerificationResponse(
    String message,
    ContactView contact,
    String userId,
    boolean requiresPasswordSetup,
    String setupToken
) {}
