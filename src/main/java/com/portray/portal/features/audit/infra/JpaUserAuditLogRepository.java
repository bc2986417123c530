package com.portray.portal.features.audit.infra;

import com.portray.portal.features.audit.domain.UserAuditLog;
import com.portray.portal.features.audit.domain.UserAuditLogRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JpaUserAuditLogRepository extends JpaRepository<UserAuditLog, Long>, UserAuditLogRepository {

    @Override
    List<UserAuditLog> findByTargetUserIdOrderByCreatedAtDesc(String targetUserId);
}
