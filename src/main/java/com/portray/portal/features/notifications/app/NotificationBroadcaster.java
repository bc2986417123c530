package com.portray.portal.features.notifications.app;

import com.portray.portal.features.notifications.api.dto.NotificationView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

/**
 * Pushes stored notifications to the owner's STOMP queue.
 */
@Service
public class NotificationBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(NotificationBroadcaster.class);

    private final SimpMessagingTemplate messagingTemplate;

    public NotificationBroadcaster(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    public void sendToUser(NotificationView notification) {
        try {
            messagingTemplate.convertAndSendToUser(notification.userId(), "/queue/notifications", notification);
            log.debug("Sent notification {} to user {}", notification.id(), notification.userId());
        } catch (Exception e) {
            log.error("Failed to push notification {} to user {}", notification.id(), notification.userId(), e);
        }
    }
}
