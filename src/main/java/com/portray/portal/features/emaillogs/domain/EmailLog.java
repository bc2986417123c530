package com.portray.portal.features.emaillogs.domain;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * One attempt to send a portal email, kept whether or not the transport accepted it.
 */
@Entity
@Table(name = "email_logs")
public class EmailLog {

    public static final String SENT = "sent";
    public static final String FAILED = "failed";
    public static final String SKIPPED = "skipped";

    public static final String TYPE_VERIFICATION = "verification";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "port_id", updatable = false)
    private Long portId;

    @Column(name = "contact_id", updatable = false)
    private Long contactId;

    @Column(name = "email_type", nullable = false, updatable = false)
    private String emailType;

    @Column(nullable = false, updatable = false)
    private String recipient;

    @Column(nullable = false, updatable = false)
    private String subject;

    @Column(nullable = false, updatable = false)
    private String status;

    @Column(name = "error_message", updatable = false)
    private String errorMessage;

    @Column(name = "sent_at", nullable = false, updatable = false)
    private Instant sentAt;

    protected EmailLog() {
        // JPA constructor
    }

    public EmailLog(Long portId, Long contactId, String emailType, String recipient, String subject,
                    String status, String errorMessage, Instant sentAt) {
        this.portId = portId;
        this.contactId = contactId;
        this.emailType = emailType;
        this.recipient = recipient;
        this.subject = subject;
        this.status = status;
        this.errorMessage = errorMessage;
        this.sentAt = sentAt;
    }

    public Long getId() { return id; }
    public Long getPortId() { return portId; }
    public Long getContactId() { return contactId; }
    public String getEmailType() { return emailType; }
    public String getRecipient() { return recipient; }
    public String getSubject() { return subject; }
    public String getStatus() { return status; }
    public String getErrorMessage() { return errorMessage; }
    public Instant getSentAt() { return sentAt; }
}
