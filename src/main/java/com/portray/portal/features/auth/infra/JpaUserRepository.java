package com.portray.portal.features.auth.infra;

import com.portray.portal.common.security.UserRole;
import com.portray.portal.features.auth.domain.User;
import com.portray.portal.features.auth.domain.UserRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface JpaUserRepository extends JpaRepository<User, String>, UserRepository {

    @Override
    Optional<User> findByEmail(String email);

    @Override
    boolean existsByEmail(String email);

    @Override
    List<User> findAllByOrderByCreatedAtDesc();

    @Override
    List<User> findByRoleAndActiveTrue(UserRole role);
}
