package com.portray.portal.features.auth.domain;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Bearer session. Only the SHA-256 digest of the token is stored.
 */
@Entity
@Table(name = "sessions")
public class Session extends com.portray.portal.common.domain.Entity<String> {

    @Id
    @Column(name = "session_id")
    private String sessionId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "token_hash", nullable = false, unique = true)
    private String tokenHash;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Session() {
        // JPA constructor
    }

    public Session(String userId, String tokenHash, Instant createdAt, Instant expiresAt) {
        this.sessionId = "ses_" + UUID.randomUUID().toString().replace("-", "");
        this.userId = Objects.requireNonNull(userId);
        this.tokenHash = Objects.requireNonNull(tokenHash);
        this.createdAt = Objects.requireNonNull(createdAt);
        this.expiresAt = Objects.requireNonNull(expiresAt);
    }

    @Override
    public String getId() {
        return sessionId;
    }

    public String getUserId() { return userId; }
    public String getTokenHash() { return tokenHash; }
    public Instant getExpiresAt() { return expiresAt; }
    public Instant getCreatedAt() { return createdAt; }

    /**
     * Valid strictly before expiresAt.
     */
    public boolean isLiveAt(Instant now) {
        return expiresAt.isAfter(now);
    }
}
