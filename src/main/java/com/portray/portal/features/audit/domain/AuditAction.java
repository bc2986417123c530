package com.portray.portal.features.audit.domain;

public enum AuditAction {
    CREATED("created"),
    UPDATED("updated"),
    STATUS_CHANGED("status_changed"),
    ROLE_CHANGED("role_changed"),
    VERIFIED("verified"),
    PASSWORD_SETUP("password_setup"),
    DELETED("deleted"),
    LOGIN("login");

    private final String label;

    AuditAction(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
