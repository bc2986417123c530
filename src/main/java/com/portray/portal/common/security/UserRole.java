package com.portray.portal.common.security;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Account roles. The label is the wire form ("SystemAdmin", "PortAdmin", "user").
 */
public enum UserRole {
    SYSTEM_ADMIN("SystemAdmin"),
    PORT_ADMIN("PortAdmin"),
    USER("user");

    private final String label;

    UserRole(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public String authority() {
        return "ROLE_" + name();
    }

    @JsonCreator
    public static UserRole fromLabel(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Role is required");
        }
        return Arrays.stream(values())
                .filter(role -> role.label.equalsIgnoreCase(value) || role.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + value));
    }
}
