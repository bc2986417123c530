package com.portray.portal.features.auth.domain;

import com.portray.portal.common.security.UserRole;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

@Entity
@Table(name = "users")
public class User extends com.portray.portal.common.domain.Entity<String> {

    /**
     * Stored in place of a hash for accounts provisioned by contact verification.
     * Not a valid BCrypt string, so no password can ever match it.
     */
    public static final String PASSWORD_NOT_SET = "!unset";

    @Id
    @Column(name = "user_id")
    private String userId;

    @Column(nullable = false, unique = true)
    private String email;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(name = "first_name", nullable = false)
    private String firstName;

    @Column(name = "last_name", nullable = false)
    private String lastName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private UserRole role;

    @Column(name = "user_type")
    private String userType;

    @Column(name = "port_id")
    private Long portId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "terminal_ids", nullable = false, columnDefinition = "jsonb")
    private List<Long> terminalIds = new ArrayList<>();

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "last_login")
    private Instant lastLogin;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected User() {
        // JPA constructor
    }

    public User(String userId, String email, String passwordHash,
                String firstName, String lastName, UserRole role) {
        super(userId);
        this.userId = Objects.requireNonNull(userId);
        this.email = Objects.requireNonNull(email);
        this.passwordHash = Objects.requireNonNull(passwordHash);
        this.firstName = Objects.requireNonNullElse(firstName, "");
        this.lastName = Objects.requireNonNullElse(lastName, "");
        this.role = Objects.requireNonNull(role);
        this.active = true;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public static String newId() {
        return "user_" + UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Account created on first contact verification: inactive until password setup.
     */
    public static User provisioned(String email, String firstName, String lastName, UserRole role) {
        User user = new User(newId(), email, PASSWORD_NOT_SET, firstName, lastName, role);
        user.active = false;
        return user;
    }

    @Override
    public String getId() {
        return userId;
    }

    public String getUserId() {
        return getId();
    }

    public String getEmail() { return email; }
    public String getPasswordHash() { return passwordHash; }
    public String getFirstName() { return firstName; }
    public String getLastName() { return lastName; }
    public UserRole getRole() { return role; }
    public String getUserType() { return userType; }
    public Long getPortId() { return portId; }
    public List<Long> getTerminalIds() { return List.copyOf(terminalIds); }
    public boolean isActive() { return active; }
    public Instant getLastLogin() { return lastLogin; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public boolean isPasswordSet() {
        return !PASSWORD_NOT_SET.equals(passwordHash);
    }

    public void recordLogin(Instant at) {
        this.lastLogin = at;
    }

    public void completePasswordSetup(String passwordHash, Instant at) {
        this.passwordHash = Objects.requireNonNull(passwordHash);
        this.active = true;
        this.lastLogin = at;
        touch();
    }

    public void changePassword(String passwordHash) {
        this.passwordHash = Objects.requireNonNull(passwordHash);
        touch();
    }

    public void updateProfile(String email, String firstName, String lastName, String userType,
                              Long portId, List<Long> terminalIds) {
        this.email = Objects.requireNonNull(email);
        this.firstName = Objects.requireNonNullElse(firstName, "");
        this.lastName = Objects.requireNonNullElse(lastName, "");
        this.userType = userType;
        this.portId = portId;
        this.terminalIds = terminalIds == null ? new ArrayList<>() : new ArrayList<>(terminalIds);
        touch();
    }

    public void rename(String firstName, String lastName) {
        this.firstName = Objects.requireNonNullElse(firstName, "");
        this.lastName = Objects.requireNonNullElse(lastName, "");
        touch();
    }

    public void changeRole(UserRole role) {
        this.role = Objects.requireNonNull(role);
        touch();
    }

    public void toggleActive() {
        this.active = !this.active;
        touch();
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
