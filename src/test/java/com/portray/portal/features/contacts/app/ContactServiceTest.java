package com.portray.portal.features.contacts.app;

import com.portray.portal.common.exception.ConflictException;
import com.portray.portal.common.tx.SideEffectExecutor;
import com.portray.portal.features.contacts.api.dto.ContactRequest;
import com.portray.portal.features.contacts.api.dto.UpdateContactRequest;
import com.portray.portal.features.contacts.domain.PortAdminContact;
import com.portray.portal.features.contacts.domain.PortAdminContactRepository;
import com.portray.portal.features.ports.app.PortService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ContactServiceTest {

    private PortAdminContactRepository contactRepository;
    private ContactVerificationService verificationService;
    private VerificationMailer mailer;
    private ContactService service;

    @BeforeEach
    void setUp() {
        contactRepository = mock(PortAdminContactRepository.class);
        verificationService = mock(ContactVerificationService.class);
        mailer = mock(VerificationMailer.class);
        service = new ContactService(contactRepository, mock(PortService.class), verificationService, mailer,
                new SideEffectExecutor(mock(PlatformTransactionManager.class)));

        when(contactRepository.save(any(PortAdminContact.class))).thenAnswer(inv -> inv.getArgument(0));
        when(verificationService.issueVerification(any(PortAdminContact.class))).thenReturn("raw-token");

        // stands in for the surrounding @Transactional boundary
        TransactionSynchronizationManager.initSynchronization();
    }

    @AfterEach
    void tearDown() {
        TransactionSynchronizationManager.clearSynchronization();
    }

    private static ContactRequest request(String email) {
        return new ContactRequest(4L, "Priya Raman", "Harbour Master", email, "9876543210", null);
    }

    private static void commit() {
        for (TransactionSynchronization synchronization : TransactionSynchronizationManager.getSynchronizations()) {
            synchronization.afterCommit();
        }
    }

    @Test
    @DisplayName("Verification email goes out only after the contact is committed")
    void mailsAfterCommit() {
        service.create(request(" priya@example.com "));

        verifyNoInteractions(mailer);

        commit();
        verify(mailer).sendVerification(eq(4L), any(), eq("priya@example.com"), eq("raw-token"));
    }

    @Test
    @DisplayName("A rolled back create sends nothing")
    void rollbackSendsNothing() {
        service.create(request("priya@example.com"));

        for (TransactionSynchronization synchronization : TransactionSynchronizationManager.getSynchronizations()) {
            synchronization.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK);
        }
        verifyNoInteractions(mailer);
    }

    @Test
    @DisplayName("Duplicate email is a conflict and issues no token")
    void duplicateEmail() {
        when(contactRepository.existsByEmail("priya@example.com")).thenReturn(true);

        assertThrows(ConflictException.class, () -> service.create(request("priya@example.com")));

        verifyNoInteractions(verificationService);
        assertTrue(TransactionSynchronizationManager.getSynchronizations().isEmpty());
    }

    @Test
    @DisplayName("Changing the email of an unverified contact mails the new address after commit")
    void emailChangeReissues() {
        PortAdminContact contact = new PortAdminContact(4L, "Priya Raman", "Harbour Master", "old@example.com",
                "9876543210", null);
        when(contactRepository.findById(9L)).thenReturn(Optional.of(contact));

        service.update(9L, new UpdateContactRequest(null, null, "new@example.com", null, null));
        verifyNoInteractions(mailer);

        commit();
        verify(mailer).sendVerification(eq(4L), any(), eq("new@example.com"), eq("raw-token"));
    }

    @Test
    @DisplayName("Unchanged email sends nothing")
    void sameEmailNoMail() {
        PortAdminContact contact = new PortAdminContact(4L, "Priya Raman", "Harbour Master", "priya@example.com",
                "9876543210", null);
        when(contactRepository.findById(9L)).thenReturn(Optional.of(contact));

        service.update(9L, new UpdateContactRequest("Priya R", null, null, null, null));
        commit();

        verify(mailer, never()).sendVerification(anyLong(), any(), anyString(), anyString());
        assertEquals("Priya R", contact.getContactName());
    }
}
