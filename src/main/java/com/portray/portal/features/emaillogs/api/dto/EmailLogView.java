package com.portray.portal.features.emaillogs.api.dto;

import com.portray.portal.features.emaillogs.domain.EmailLog;

import java.time.Instant;

public record EmailLogView(
    Long id,
    Long portId,
    Long contactId,
    String emailType,
    String recipient,
    String subject,
    String status,
    String errorMessage,
    Instant sentAt
) {
    public static EmailLogView from(EmailLog log) {
        return new EmailLogView(log.getId(), log.getPortId(), log.getContactId(), log.getEmailType(),
                log.getRecipient(), log.getSubject(), log.getStatus(), log.getErrorMessage(), log.getSentAt());
    }
}
