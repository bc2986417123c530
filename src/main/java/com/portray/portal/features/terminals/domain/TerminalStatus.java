package com.portray.portal.features.terminals.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Review state of a terminal. Labels are the stored and wire form.
 */
public enum TerminalStatus {
    PROCESSING_FOR_ACTIVATION("Processing for activation"),
    ACTIVE("Active"),
    REJECTED("Rejected");

    private final String label;

    TerminalStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static TerminalStatus fromLabel(String value) {
        for (TerminalStatus status : values()) {
            if (status.label.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Invalid status: " + value
                + ". Must be one of: Processing for activation, Active, Rejected");
    }
}
