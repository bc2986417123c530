package com.portray.portal.features.contacts.domain;

import java.util.List;
import java.util.Optional;

public interface PortAdminContactRepository {
    PortAdminContact save(PortAdminContact contact);
    Optional<PortAdminContact> findById(Long id);
    Optional<PortAdminContact> findByVerificationToken(String tokenDigest);
    boolean existsByEmail(String email);
    List<PortAdminContact> findAllByOrderByCreatedAtDesc();
    List<PortAdminContact> findByPortIdOrderByCreatedAtDesc(Long portId);
    void delete(PortAdminContact contact);
}
