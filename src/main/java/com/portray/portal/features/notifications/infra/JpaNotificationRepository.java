package com.portray.portal.features.notifications.infra;

import com.portray.portal.features.notifications.domain.Notification;
import com.portray.portal.features.notifications.domain.NotificationRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JpaNotificationRepository extends JpaRepository<Notification, Long>, NotificationRepository {

    @Override
    List<Notification> findByUserIdOrderByCreatedAtDesc(String userId);

    @Override
    long countByUserIdAndReadFalse(String userId);

    @Override
    @Modifying
    @Query("UPDATE Notification n SET n.read = true, n.updatedAt = CURRENT_TIMESTAMP "
            + "WHERE n.userId = :userId AND n.read = false")
    int markAllReadByUserId(@Param("userId") String userId);
}
