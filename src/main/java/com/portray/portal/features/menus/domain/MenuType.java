package com.portray.portal.features.menus.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * GLINK: top-level group link. PLINK: page link, always the child of a GLINK.
 */
public enum MenuType {
    GLINK("glink"),
    PLINK("plink");

    private final String label;

    MenuType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static MenuType fromLabel(String value) {
        for (MenuType type : values()) {
            if (type.label.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown menu type: " + value);
    }
}
