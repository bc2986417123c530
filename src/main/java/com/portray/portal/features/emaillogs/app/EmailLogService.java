package com.portray.portal.features.emaillogs.app;

import com.portray.portal.features.emaillogs.api.dto.EmailLogView;
import com.portray.portal.features.emaillogs.domain.EmailLog;
import com.portray.portal.features.emaillogs.domain.EmailLogRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

@Service
public class EmailLogService {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final EmailLogRepository emailLogRepository;
    private final Clock clock;

    public EmailLogService(EmailLogRepository emailLogRepository, Clock clock) {
        this.emailLogRepository = emailLogRepository;
        this.clock = clock;
    }

    @Transactional
    public EmailLog record(Long portId, Long contactId, String emailType, String recipient, String subject,
                           String status, String errorMessage) {
        return emailLogRepository.save(new EmailLog(portId, contactId, emailType, recipient, subject, status,
                truncate(errorMessage), clock.instant()));
    }

    /**
     * Newest first. A contact filter wins over a port filter; no filter lists everything.
     */
    @Transactional(readOnly = true)
    public List<EmailLogView> list(Long portId, Long contactId) {
        List<EmailLog> logs;
        if (contactId != null) {
            logs = emailLogRepository.findByContactIdOrderBySentAtDesc(contactId);
        } else if (portId != null) {
            logs = emailLogRepository.findByPortIdOrderBySentAtDesc(portId);
        } else {
            logs = emailLogRepository.findAllByOrderBySentAtDesc();
        }
        return logs.stream().map(EmailLogView::from).toList();
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
