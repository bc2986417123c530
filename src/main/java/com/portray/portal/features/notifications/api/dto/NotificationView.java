package com.portray.portal.features.notifications.api.dto;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.portray.portal.features.notifications.domain.Notification;

import java.time.Instant;

public record NotificationView(
    Long id,
    String userId,
    String type,
    String title,
    String message,
    @JsonRawValue String data,
    boolean isRead,
    Instant createdAt
) {
    public static NotificationView from(Notification notification) {
        return new NotificationView(
            notification.getId(),
            notification.getUserId(),
            notification.getType(),
            notification.getTitle(),
            notification.getMessage(),
            notification.getData(),
            notification.isRead(),
            notification.getCreatedAt()
        );
    }
}
