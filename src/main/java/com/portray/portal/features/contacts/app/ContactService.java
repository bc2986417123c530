package com.portray.portal.features.contacts.app;

import com.portray.portal.common.exception.ConflictException;
import com.portray.portal.common.exception.NotFoundException;
import com.portray.portal.common.tx.SideEffectExecutor;
import com.portray.portal.features.contacts.api.dto.ContactRequest;
import com.portray.portal.features.contacts.api.dto.ContactView;
import com.portray.portal.features.contacts.api.dto.UpdateContactRequest;
import com.portray.portal.features.contacts.domain.PortAdminContact;
import com.portray.portal.features.contacts.domain.PortAdminContactRepository;
import com.portray.portal.features.ports.app.PortService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class ContactService {

    private static final Logger log = LoggerFactory.getLogger(ContactService.class);

    private final PortAdminContactRepository contactRepository;
    private final PortService portService;
    private final ContactVerificationService verificationService;
    private final VerificationMailer mailer;
    private final SideEffectExecutor sideEffects;

    public ContactService(
            PortAdminContactRepository contactRepository,
            PortService portService,
            ContactVerificationService verificationService,
            VerificationMailer mailer,
            SideEffectExecutor sideEffects) {
        this.contactRepository = contactRepository;
        this.portService = portService;
        this.verificationService = verificationService;
        this.mailer = mailer;
        this.sideEffects = sideEffects;
    }

    @Transactional(readOnly = true)
    public List<ContactView> list() {
        return contactRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(ContactView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ContactView> listByPort(Long portId) {
        portService.requireExists(portId);
        return contactRepository.findByPortIdOrderByCreatedAtDesc(portId).stream()
                .map(ContactView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public ContactView get(Long id) {
        return ContactView.from(load(id));
    }

    /**
     * Creates the contact, issues its first verification token and mails the link.
     */
    @Transactional
    public ContactView create(ContactRequest request) {
        portService.requireExists(request.portId());
        String email = request.email().trim();
        if (contactRepository.existsByEmail(email)) {
            throw new ConflictException("A contact with this email already exists");
        }

        PortAdminContact contact = new PortAdminContact(
                request.portId(),
                request.contactName().trim(),
                request.designation(),
                email,
                request.mobileNumber(),
                request.status());
        contactRepository.save(contact);

        sendVerificationAfterCommit(contact, verificationService.issueVerification(contact));

        log.info("Contact {} created for port {}", contact.getId(), contact.getPortId());
        return ContactView.from(contact);
    }

    /**
     * Changing the email of an unverified contact issues a new token to the new address.
     * A verified contact keeps its email.
     */
    @Transactional
    public ContactView update(Long id, UpdateContactRequest request) {
        PortAdminContact contact = load(id);
        String email = request.email() != null ? request.email().trim() : contact.getEmail();
        boolean emailChanged = !email.equals(contact.getEmail());

        if (emailChanged) {
            if (contact.isVerified()) {
                throw new IllegalStateException("The email of a verified contact cannot be changed");
            }
            if (contactRepository.existsByEmail(email)) {
                throw new ConflictException("A contact with this email already exists");
            }
        }

        contact.updateDetails(
                request.contactName() != null ? request.contactName().trim() : contact.getContactName(),
                request.designation() != null ? request.designation() : contact.getDesignation(),
                email,
                request.mobileNumber() != null ? request.mobileNumber() : contact.getMobileNumber());
        if (request.status() != null) {
            contact.changeStatus(request.status());
        }
        contactRepository.save(contact);

        if (emailChanged) {
            sendVerificationAfterCommit(contact, verificationService.issueVerification(contact));
        }
        return ContactView.from(contact);
    }

    @Transactional
    public ContactView toggleStatus(Long id) {
        PortAdminContact contact = load(id);
        contact.toggleStatus();
        contactRepository.save(contact);
        return ContactView.from(contact);
    }

    @Transactional
    public void delete(Long id) {
        PortAdminContact contact = load(id);
        contactRepository.delete(contact);
        log.info("Contact {} deleted", id);
    }

    /**
     * Always issues a fresh token; fails for a verified contact.
     */
    @Transactional
    public ContactView resendVerification(Long id) {
        PortAdminContact contact = load(id);
        sendVerificationAfterCommit(contact, verificationService.issueVerification(contact));
        return ContactView.from(contact);
    }

    // the link is only mailed once its token digest is committed
    private void sendVerificationAfterCommit(PortAdminContact contact, String token) {
        Long portId = contact.getPortId();
        Long contactId = contact.getId();
        String recipient = contact.getEmail();
        sideEffects.afterCommit("send verification email to " + recipient,
                () -> mailer.sendVerification(portId, contactId, recipient, token));
    }

    private PortAdminContact load(Long id) {
        return contactRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Contact not found: " + id));
    }
}
