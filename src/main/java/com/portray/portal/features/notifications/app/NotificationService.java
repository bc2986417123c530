package com.portray.portal.features.notifications.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portray.portal.common.exception.NotFoundException;
import com.portray.portal.common.security.UserRole;
import com.portray.portal.common.tx.SideEffectExecutor;
import com.portray.portal.features.auth.domain.User;
import com.portray.portal.features.auth.domain.UserRepository;
import com.portray.portal.features.notifications.api.dto.NotificationView;
import com.portray.portal.features.notifications.domain.Notification;
import com.portray.portal.features.notifications.domain.NotificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Per-user inbox. Sending is fire-and-forget: {@link #notify} and {@link #notifySystemAdmins}
 * never throw, whatever happens to the write or the push.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationRepository notificationRepository;
    private final UserRepository userRepository;
    private final NotificationBroadcaster broadcaster;
    private final SideEffectExecutor sideEffects;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public NotificationService(
            NotificationRepository notificationRepository,
            UserRepository userRepository,
            NotificationBroadcaster broadcaster,
            SideEffectExecutor sideEffects,
            ObjectMapper objectMapper,
            Clock clock) {
        this.notificationRepository = notificationRepository;
        this.userRepository = userRepository;
        this.broadcaster = broadcaster;
        this.sideEffects = sideEffects;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void notify(String userId, String type, String title, String message, Map<String, Object> data) {
        try {
            Notification notification = new Notification(
                    userId, type, title, message,
                    data == null ? null : objectMapper.writeValueAsString(data),
                    clock.instant());
            sideEffects.afterCommit("store " + type + " notification for user " + userId, () -> {
                Notification saved = notificationRepository.save(notification);
                broadcaster.sendToUser(NotificationView.from(saved));
            });
        } catch (Exception e) {
            log.error("Failed to create {} notification for user {}", type, userId, e);
        }
    }

    public void notifySystemAdmins(String type, String title, String message, Map<String, Object> data) {
        try {
            List<User> admins = userRepository.findByRoleAndActiveTrue(UserRole.SYSTEM_ADMIN);
            if (admins.isEmpty()) {
                log.warn("No active SystemAdmin to receive {} notification", type);
            }
            admins.forEach(admin -> notify(admin.getUserId(), type, title, message, data));
        } catch (Exception e) {
            log.error("Failed to notify system admins ({})", type, e);
        }
    }

    @Transactional(readOnly = true)
    public List<NotificationView> list(String userId) {
        return notificationRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(NotificationView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public long unreadCount(String userId) {
        return notificationRepository.countByUserIdAndReadFalse(userId);
    }

    @Transactional
    public NotificationView markRead(Long id, String userId) {
        Notification notification = loadOwned(id, userId);
        notification.markRead();
        notificationRepository.save(notification);
        return NotificationView.from(notification);
    }

    @Transactional
    public int markAllRead(String userId) {
        return notificationRepository.markAllReadByUserId(userId);
    }

    @Transactional
    public void delete(Long id, String userId) {
        notificationRepository.delete(loadOwned(id, userId));
    }

    /**
     * Someone else's notification is reported as missing.
     */
    private Notification loadOwned(Long id, String userId) {
        return notificationRepository.findById(id)
                .filter(notification -> notification.belongsTo(userId))
                .orElseThrow(() -> new NotFoundException("Notification not found: " + id));
    }
}
