package com.portray.portal.features.audit.domain;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * One immutable entry of a user's account history. Never updated after insert.
 */
@Entity
@Table(name = "user_audit_logs")
public class UserAuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "target_user_id", nullable = false, updatable = false)
    private String targetUserId;

    @Column(name = "performed_by", updatable = false)
    private String performedBy;

    @Column(nullable = false, updatable = false)
    private String action;

    @Column(nullable = false, updatable = false)
    private String description;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "old_values", columnDefinition = "jsonb", updatable = false)
    private String oldValues;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "new_values", columnDefinition = "jsonb", updatable = false)
    private String newValues;

    @Column(name = "ip_address", updatable = false)
    private String ipAddress;

    @Column(name = "user_agent", updatable = false)
    private String userAgent;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected UserAuditLog() {
        // JPA constructor
    }

    public UserAuditLog(String targetUserId, String performedBy, AuditAction action, String description,
                        String oldValues, String newValues, String ipAddress, String userAgent,
                        Instant createdAt) {
        this.targetUserId = targetUserId;
        this.performedBy = performedBy;
        this.action = action.getLabel();
        this.description = description;
        this.oldValues = oldValues;
        this.newValues = newValues;
        this.ipAddress = ipAddress;
        this.userAgent = userAgent;
        this.createdAt = createdAt;
    }

    public Long getId() { return id; }
    public String getTargetUserId() { return targetUserId; }
    public String getPerformedBy() { return performedBy; }
    public String getAction() { return action; }
    public String getDescription() { return description; }
    public String getOldValues() { return oldValues; }
    public String getNewValues() { return newValues; }
    public String getIpAddress() { return ipAddress; }
    public String getUserAgent() { return userAgent; }
    public Instant getCreatedAt() { return createdAt; }
}
