package com.portray.portal.features.contacts.domain;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.Objects;

/**
 * A person responsible for a port. Verification state machine:
 * pending token, then verified (status active, token cleared) at most once per token.
 * Only the digest of the verification token is stored.
 */
@Entity
@Table(name = "port_admin_contacts")
public class PortAdminContact extends com.portray.portal.common.domain.Entity<Long> {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "port_id", nullable = false)
    private Long portId;

    @Column(name = "contact_name", nullable = false)
    private String contactName;

    @Column(nullable = false)
    private String designation;

    @Column(nullable = false, unique = true)
    private String email;

    @Column(name = "mobile_number", nullable = false)
    private String mobileNumber;

    @Column(nullable = false)
    private ContactStatus status;

    @Column(name = "verification_token", unique = true)
    private String verificationToken;

    @Column(name = "verification_token_expires")
    private Instant verificationTokenExpires;

    @Column(name = "is_verified", nullable = false)
    private boolean verified;

    @Column(name = "user_id")
    private String userId;

    @Version
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected PortAdminContact() {
        // JPA constructor
    }

    public PortAdminContact(Long portId, String contactName, String designation, String email,
                            String mobileNumber, ContactStatus status) {
        this.portId = Objects.requireNonNull(portId);
        updateDetails(contactName, designation, email, mobileNumber);
        this.status = status != null ? status : ContactStatus.INACTIVE;
        this.verified = false;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @Override
    public Long getId() { return id; }
    public Long getPortId() { return portId; }
    public String getContactName() { return contactName; }
    public String getDesignation() { return designation; }
    public String getEmail() { return email; }
    public String getMobileNumber() { return mobileNumber; }
    public ContactStatus getStatus() { return status; }
    public Instant getVerificationTokenExpires() { return verificationTokenExpires; }
    public boolean isVerified() { return verified; }
    public String getUserId() { return userId; }
    public long getVersion() { return version; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public boolean hasPendingToken() {
        return verificationToken != null;
    }

    /**
     * Replaces any pending token; only the latest one can verify.
     */
    public void issueVerification(String tokenDigest, Instant expiresAt) {
        if (verified) {
            throw new IllegalStateException("Contact is already verified");
        }
        this.verificationToken = Objects.requireNonNull(tokenDigest);
        this.verificationTokenExpires = Objects.requireNonNull(expiresAt);
    }

    public boolean isTokenExpiredAt(Instant now) {
        return verificationTokenExpires == null || !verificationTokenExpires.isAfter(now);
    }

    public void markVerified(String userId) {
        if (verified) {
            throw new IllegalStateException("Contact is already verified");
        }
        this.verified = true;
        this.status = ContactStatus.ACTIVE;
        this.verificationToken = null;
        this.verificationTokenExpires = null;
        this.userId = Objects.requireNonNull(userId);
    }

    public void updateDetails(String contactName, String designation, String email, String mobileNumber) {
        this.contactName = Objects.requireNonNull(contactName);
        this.designation = Objects.requireNonNull(designation);
        this.email = Objects.requireNonNull(email);
        this.mobileNumber = Objects.requireNonNull(mobileNumber);
    }

    public void changeStatus(ContactStatus status) {
        this.status = Objects.requireNonNull(status);
    }

    public void toggleStatus() {
        this.status = status == ContactStatus.ACTIVE ? ContactStatus.INACTIVE : ContactStatus.ACTIVE;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
