package com.portray.portal.features.audit.api.dto;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.portray.portal.features.audit.domain.UserAuditLog;

import java.time.Instant;

public record UserAuditLogView(
    Long id,
    String targetUserId,
    String performedBy,
    String action,
    String description,
    @JsonRawValue String oldValues,
    @JsonRawValue String newValues,
    String ipAddress,
    String userAgent,
    Instant createdAt
) {
    public static UserAuditLogView from(UserAuditLog entry) {
        return new UserAuditLogView(
            entry.getId(),
            entry.getTargetUserId(),
            entry.getPerformedBy(),
            entry.getAction(),
            entry.getDescription(),
            entry.getOldValues(),
            entry.getNewValues(),
            entry.getIpAddress(),
            entry.getUserAgent(),
            entry.getCreatedAt()
        );
    }
}
