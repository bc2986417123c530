package com.portray.portal.features.audit.domain;

import java.util.List;

public interface UserAuditLogRepository {
    UserAuditLog save(UserAuditLog entry);
    List<UserAuditLog> findByTargetUserIdOrderByCreatedAtDesc(String targetUserId);
}
