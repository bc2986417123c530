package com.portray.portal.features.contacts.app;

import com.portray.portal.common.config.PortalProperties;
import com.portray.portal.features.emaillogs.app.EmailLogService;
import com.portray.portal.features.emaillogs.domain.EmailLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Sends the welcome/verification email to a port admin contact and records the attempt in
 * the email log. Best effort: a missing or failing mail transport is logged and ignored.
 */
@Component
public class VerificationMailer {

    private static final Logger log = LoggerFactory.getLogger(VerificationMailer.class);

    static final String SUBJECT = "Welcome to PortRay - Verify Your Account";

    private final ObjectProvider<JavaMailSender> mailSender;
    private final EmailLogService emailLogService;
    private final PortalProperties properties;

    public VerificationMailer(
            ObjectProvider<JavaMailSender> mailSender,
            EmailLogService emailLogService,
            PortalProperties properties) {
        this.mailSender = mailSender;
        this.emailLogService = emailLogService;
        this.properties = properties;
    }

    /**
     * @return the email log status: sent, failed or skipped
     */
    public String sendVerification(Long portId, Long contactId, String recipient, String token) {
        String status;
        String error = null;
        JavaMailSender sender = mailSender.getIfAvailable();
        if (!properties.getMail().isEnabled()) {
            log.info("Mail disabled; verification link for {} not sent", recipient);
            status = EmailLog.SKIPPED;
            error = "Mail disabled";
        } else if (sender == null) {
            log.warn("No mail transport configured; verification email to {} not sent", recipient);
            status = EmailLog.SKIPPED;
            error = "No mail transport configured";
        } else {
            try {
                SimpleMailMessage message = new SimpleMailMessage();
                message.setFrom(properties.getMail().getFrom());
                message.setTo(recipient);
                message.setSubject(SUBJECT);
                message.setText(body(verificationLink(token), properties.getVerification().getTtl()));
                sender.send(message);
                log.info("Verification email sent to {}", recipient);
                status = EmailLog.SENT;
            } catch (Exception e) {
                log.error("Failed to send verification email to {}", recipient, e);
                status = EmailLog.FAILED;
                error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            }
        }

        emailLogService.record(portId, contactId, EmailLog.TYPE_VERIFICATION, recipient, SUBJECT, status, error);
        return status;
    }

    String verificationLink(String token) {
        String base = properties.getVerification().getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/verify?token=" + URLEncoder.encode(token, StandardCharsets.UTF_8);
    }

    private static String body(String link, Duration ttl) {
        return "Welcome to PortRay!\n\n"
                + "You have been added as a Port Administrator contact. "
                + "Please verify your email address to complete your account setup.\n\n"
                + "Verification Link: " + link + "\n\n"
                + "This verification link will expire in " + ttl.toHours() + " hours.\n";
    }
}
