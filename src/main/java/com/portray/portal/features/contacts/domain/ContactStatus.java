package com.portray.portal.features.contacts.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ContactStatus {
    ACTIVE("active"),
    INACTIVE("inactive");

    private final String label;

    ContactStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static ContactStatus fromLabel(String value) {
        for (ContactStatus status : values()) {
            if (status.label.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown contact status: " + value);
    }
}
