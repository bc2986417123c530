package com.portray.portal.features.audit.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portray.portal.common.security.UserRole;
import com.portray.portal.common.tx.SideEffectExecutor;
import com.portray.portal.features.audit.domain.AuditAction;
import com.portray.portal.features.audit.domain.UserAuditLog;
import com.portray.portal.features.audit.domain.UserAuditLogRepository;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only account history. Every method is best effort: a failure to record an entry
 * is logged and never surfaces to the operation being described.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final UserAuditLogRepository auditLogRepository;
    private final SideEffectExecutor sideEffects;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditService(
            UserAuditLogRepository auditLogRepository,
            SideEffectExecutor sideEffects,
            ObjectMapper objectMapper,
            Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.sideEffects = sideEffects;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void logUserCreation(String targetUserId, String performedBy, UserSnapshot created) {
        record(targetUserId, performedBy, AuditAction.CREATED,
                "User account created with email: " + created.email(), null, created);
    }

    /**
     * Writes an {@code updated} entry listing the tracked fields that differ.
     * Writes nothing when no tracked field changed.
     */
    public void logUserUpdate(String targetUserId, String performedBy,
                              UserSnapshot oldValues, UserSnapshot newValues) {
        List<String> changes = describeChanges(oldValues, newValues);
        if (changes.isEmpty()) {
            log.debug("No tracked change on user {}; skipping audit entry", targetUserId);
            return;
        }
        record(targetUserId, performedBy, AuditAction.UPDATED,
                "User profile updated: " + String.join(", ", changes), oldValues, newValues);
    }

    public void logUserStatusChange(String targetUserId, String performedBy, boolean oldStatus, boolean newStatus) {
        record(targetUserId, performedBy, AuditAction.STATUS_CHANGED,
                "User status changed from " + statusLabel(oldStatus) + " to " + statusLabel(newStatus),
                Map.of("isActive", oldStatus), Map.of("isActive", newStatus));
    }

    public void logUserRoleChange(String targetUserId, String performedBy, UserRole oldRole, UserRole newRole) {
        record(targetUserId, performedBy, AuditAction.ROLE_CHANGED,
                "User role changed from " + oldRole.getLabel() + " to " + newRole.getLabel(),
                Map.of("role", oldRole.getLabel()), Map.of("role", newRole.getLabel()));
    }

    public void logUserVerification(String targetUserId, String performedBy) {
        record(targetUserId, performedBy, AuditAction.VERIFIED,
                "User email address verified successfully",
                Map.of("isVerified", false), Map.of("isVerified", true));
    }

    public void logPasswordSetup(String targetUserId) {
        record(targetUserId, targetUserId, AuditAction.PASSWORD_SETUP,
                "User password set up successfully", null, Map.of("passwordSetup", true));
    }

    public void logUserDeletion(String targetUserId, String performedBy, UserSnapshot deleted) {
        record(targetUserId, performedBy, AuditAction.DELETED,
                "User account deleted: " + deleted.email(), deleted, null);
    }

    public void logLogin(String userId) {
        record(userId, userId, AuditAction.LOGIN, "User logged in", null, null);
    }

    @Transactional(readOnly = true)
    public List<UserAuditLog> history(String targetUserId) {
        return auditLogRepository.findByTargetUserIdOrderByCreatedAtDesc(targetUserId);
    }

    static List<String> describeChanges(UserSnapshot before, UserSnapshot after) {
        List<String> changes = new ArrayList<>();
        if (!Objects.equals(before.email(), after.email())) {
            changes.add("email changed from " + before.email() + " to " + after.email());
        }
        if (!Objects.equals(before.firstName(), after.firstName())) {
            changes.add("first name changed from " + before.firstName() + " to " + after.firstName());
        }
        if (!Objects.equals(before.lastName(), after.lastName())) {
            changes.add("last name changed from " + before.lastName() + " to " + after.lastName());
        }
        if (!Objects.equals(before.userType(), after.userType())) {
            changes.add("user type changed from " + before.userType() + " to " + after.userType());
        }
        if (!Objects.equals(before.role(), after.role())) {
            changes.add("role changed from " + before.role() + " to " + after.role());
        }
        if (!Objects.equals(before.portId(), after.portId())) {
            changes.add("port assignment changed");
        }
        if (!Objects.equals(before.terminalIds(), after.terminalIds())) {
            changes.add("terminal assignments changed");
        }
        return changes;
    }

    private void record(String targetUserId, String performedBy, AuditAction action, String description,
                        Object oldValues, Object newValues) {
        try {
            HttpServletRequest request = currentRequest();
            UserAuditLog entry = new UserAuditLog(
                    targetUserId,
                    performedBy,
                    action,
                    description,
                    toJson(oldValues),
                    toJson(newValues),
                    request != null ? clientAddress(request) : null,
                    request != null ? request.getHeader("User-Agent") : null,
                    clock.instant());
            sideEffects.afterCommit("record " + action.getLabel() + " audit entry for user " + targetUserId,
                    () -> auditLogRepository.save(entry));
        } catch (RuntimeException | JsonProcessingException e) {
            log.error("Failed to record {} audit entry for user {}", action.getLabel(), targetUserId, e);
        }
    }

    private String toJson(Object values) throws JsonProcessingException {
        return values == null ? null : objectMapper.writeValueAsString(values);
    }

    private static String statusLabel(boolean active) {
        return active ? "active" : "inactive";
    }

    private static HttpServletRequest currentRequest() {
        if (RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attributes) {
            return attributes.getRequest();
        }
        return null;
    }

    private static String clientAddress(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
