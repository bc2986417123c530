package com.portray.portal.features.terminals.domain;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Append-only trail of what happened to a terminal and who did it.
 */
@Entity
@Table(name = "activation_logs")
public class ActivationLog {

    public static final String SUBMITTED = "submitted";
    public static final String ACTIVATED = "activated";
    public static final String UPDATED = "updated";
    public static final String STATUS_CHANGED = "status_changed";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "terminal_id", nullable = false, updatable = false)
    private Long terminalId;

    @Column(nullable = false, updatable = false)
    private String action;

    @Column(nullable = false, updatable = false)
    private String description;

    @Column(name = "performed_by", updatable = false)
    private String performedBy;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", updatable = false)
    private String data;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ActivationLog() {
        // JPA constructor
    }

    public ActivationLog(Long terminalId, String action, String description, String performedBy,
                         String data, Instant createdAt) {
        this.terminalId = terminalId;
        this.action = action;
        this.description = description;
        this.performedBy = performedBy;
        this.data = data;
        this.createdAt = createdAt;
    }

    public Long getId() { return id; }
    public Long getTerminalId() { return terminalId; }
    public String getAction() { return action; }
    public String getDescription() { return description; }
    public String getPerformedBy() { return performedBy; }
    public String getData() { return data; }
    public Instant getCreatedAt() { return createdAt; }
}
