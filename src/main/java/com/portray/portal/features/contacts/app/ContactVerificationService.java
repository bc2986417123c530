package com.portray.portal.features.contacts.app;

import com.portray.portal.common.config.PortalProperties;
import com.portray.portal.common.exception.AlreadyVerifiedException;
import com.portray.portal.common.exception.InvalidTokenException;
import com.portray.portal.common.exception.NotFoundException;
import com.portray.portal.common.security.OpaqueTokens;
import com.portray.portal.common.security.SetupTokenProvider;
import com.portray.portal.common.security.UserRole;
import com.portray.portal.features.audit.app.AuditService;
import com.portray.portal.features.audit.app.UserSnapshot;
import com.portray.portal.features.auth.domain.User;
import com.portray.portal.features.auth.domain.UserRepository;
import com.portray.portal.features.contacts.domain.PortAdminContact;
import com.portray.portal.features.contacts.domain.PortAdminContactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Issues and consumes contact verification tokens, and links each verified contact
 * to a user account, provisioning one when the email is unknown.
 */
@Service
public class ContactVerificationService {

    private static final Logger log = LoggerFactory.getLogger(ContactVerificationService.class);
    private static final String INVALID_TOKEN = "Invalid or expired verification token";

    private final PortAdminContactRepository contactRepository;
    private final UserRepository userRepository;
    private final SetupTokenProvider setupTokenProvider;
    private final AuditService auditService;
    private final PortalProperties.Verification settings;
    private final Clock clock;

    public ContactVerificationService(
            PortAdminContactRepository contactRepository,
            UserRepository userRepository,
            SetupTokenProvider setupTokenProvider,
            AuditService auditService,
            PortalProperties properties,
            Clock clock) {
        this.contactRepository = contactRepository;
        this.userRepository = userRepository;
        this.setupTokenProvider = setupTokenProvider;
        this.auditService = auditService;
        this.settings = properties.getVerification();
        this.clock = clock;
    }

    /**
     * Generates a fresh token for the contact, replacing any pending one.
     *
     * @return the raw token; only its digest is persisted
     * @throws AlreadyVerifiedException when the contact has already been verified
     */
    @Transactional
    public String issueVerification(Long contactId) {
        PortAdminContact contact = contactRepository.findById(contactId)
                .orElseThrow(() -> new NotFoundException("Contact not found: " + contactId));
        return issueVerification(contact);
    }

    @Transactional
    public String issueVerification(PortAdminContact contact) {
        if (contact.isVerified()) {
            throw new AlreadyVerifiedException("Contact is already verified");
        }
        String token = OpaqueTokens.newToken();
        Instant expiresAt = clock.instant().plus(settings.getTtl());
        contact.issueVerification(OpaqueTokens.digest(token), expiresAt);
        contactRepository.save(contact);
        log.info("Issued verification token for contact {} expiring at {}", contact.getId(), expiresAt);
        return token;
    }

    /**
     * Verifies the contact owning {@code token}. A token works once and only before it expires;
     * an expired token leaves the contact pending.
     */
    @Transactional
    public VerificationResult consumeVerification(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException(INVALID_TOKEN);
        }
        PortAdminContact contact = contactRepository.findByVerificationToken(OpaqueTokens.digest(token))
                .orElseThrow(() -> {
                    log.warn("Verification attempted with unknown token");
                    return new InvalidTokenException(INVALID_TOKEN);
                });

        if (contact.isVerified()) {
            throw new AlreadyVerifiedException("Contact is already verified");
        }
        if (contact.isTokenExpiredAt(clock.instant())) {
            log.warn("Verification attempted with expired token for contact {}", contact.getId());
            throw new InvalidTokenException(INVALID_TOKEN);
        }

        User user = linkUser(contact);
        contact.markVerified(user.getUserId());
        contactRepository.save(contact);

        auditService.logUserVerification(user.getUserId(), user.getUserId());
        log.info("Contact {} verified and linked to user {}", contact.getId(), user.getUserId());

        boolean requiresPasswordSetup = !user.isPasswordSet();
        String setupToken = requiresPasswordSetup ? setupTokenProvider.generateToken(user.getUserId()) : null;
        return new VerificationResult(contact, user.getUserId(), requiresPasswordSetup, setupToken);
    }

    /**
     * Finds or provisions the account for the contact's email. An existing account takes the
     * contact's name and the PortAdmin role; the overwrite is logged and audited.
     */
    private User linkUser(PortAdminContact contact) {
        String[] names = splitName(contact.getContactName());
        Optional<User> existing = userRepository.findByEmail(contact.getEmail());

        if (existing.isEmpty()) {
            User provisioned = User.provisioned(contact.getEmail(), names[0], names[1], UserRole.PORT_ADMIN);
            userRepository.save(provisioned);
            auditService.logUserCreation(provisioned.getUserId(), provisioned.getUserId(),
                    UserSnapshot.of(provisioned));
            log.info("Provisioned user {} for contact {}", provisioned.getUserId(), contact.getId());
            return provisioned;
        }

        User user = existing.get();
        UserSnapshot before = UserSnapshot.of(user);
        user.rename(names[0], names[1]);
        user.changeRole(UserRole.PORT_ADMIN);
        UserSnapshot after = UserSnapshot.of(user);
        if (!before.equals(after)) {
            log.warn("Contact {} verification overwrites profile of existing user {}: {} -> {}",
                    contact.getId(), user.getUserId(), before, after);
            userRepository.save(user);
            auditService.logUserUpdate(user.getUserId(), user.getUserId(), before, after);
        }
        return user;
    }

    static String[] splitName(String contactName) {
        String trimmed = contactName == null ? "" : contactName.trim();
        int space = trimmed.indexOf(' ');
        if (space < 0) {
            return new String[] {trimmed, ""};
        }
        return new String[] {trimmed.substring(0, space), trimmed.substring(space + 1).trim()};
    }

    public record VerificationResult(
            PortAdminContact contact,
            String userId,
            boolean requiresPasswordSetup,
            String setupToken) {}
}
