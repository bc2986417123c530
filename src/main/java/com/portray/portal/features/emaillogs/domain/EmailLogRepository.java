package com.portray.portal.features.emaillogs.domain;

import java.util.List;

public interface EmailLogRepository {
    EmailLog save(EmailLog log);
    List<EmailLog> findAllByOrderBySentAtDesc();
    List<EmailLog> findByPortIdOrderBySentAtDesc(Long portId);
    List<EmailLog> findByContactIdOrderBySentAtDesc(Long contactId);
}
