package com.portray.portal.features.auth.domain;

import java.time.Instant;
import java.util.Optional;

public interface SessionRepository {
    Session save(Session session);
    Optional<Session> findByTokenHash(String tokenHash);
    void delete(Session session);
    int deleteByTokenHash(String tokenHash);
    int deleteAllByUserId(String userId);
    int deleteExpired(Instant now);
}
