package com.portray.portal.features.auth.domain;

import com.portray.portal.common.security.UserRole;

import java.util.List;
import java.util.Optional;

public interface UserRepository {
    User save(User user);
    Optional<User> findById(String userId);
    Optional<User> findByEmail(String email);
    boolean existsByEmail(String email);
    List<User> findAllByOrderByCreatedAtDesc();
    List<User> findByRoleAndActiveTrue(UserRole role);
    void delete(User user);
}
