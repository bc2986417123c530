package com.portray.portal.features.contacts.infra;

import com.portray.portal.features.contacts.domain.PortAdminContact;
import com.portray.portal.features.contacts.domain.PortAdminContactRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface JpaPortAdminContactRepository
        extends JpaRepository<PortAdminContact, Long>, PortAdminContactRepository {

    @Override
    Optional<PortAdminContact> findByVerificationToken(String tokenDigest);

    @Override
    boolean existsByEmail(String email);

    @Override
    List<PortAdminContact> findAllByOrderByCreatedAtDesc();

    @Override
    List<PortAdminContact> findByPortIdOrderByCreatedAtDesc(Long portId);
}
