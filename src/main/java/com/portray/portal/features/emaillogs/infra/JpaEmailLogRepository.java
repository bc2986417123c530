package com.portray.portal.features.emaillogs.infra;

import com.portray.portal.features.emaillogs.domain.EmailLog;
import com.portray.portal.features.emaillogs.domain.EmailLogRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JpaEmailLogRepository extends JpaRepository<EmailLog, Long>, EmailLogRepository {

    @Override
    List<EmailLog> findAllByOrderBySentAtDesc();

    @Override
    List<EmailLog> findByPortIdOrderBySentAtDesc(Long portId);

    @Override
    List<EmailLog> findByContactIdOrderBySentAtDesc(Long contactId);
}
