package com.portray.portal.features.auth.infra;

import com.portray.portal.features.auth.domain.Session;
import com.portray.portal.features.auth.domain.SessionRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface JpaSessionRepository extends JpaRepository<Session, String>, SessionRepository {

    @Override
    Optional<Session> findByTokenHash(String tokenHash);

    @Override
    @Modifying
    @Query("DELETE FROM Session s WHERE s.tokenHash = :tokenHash")
    int deleteByTokenHash(@Param("tokenHash") String tokenHash);

    @Override
    @Modifying
    @Query("DELETE FROM Session s WHERE s.userId = :userId")
    int deleteAllByUserId(@Param("userId") String userId);

    @Override
    @Modifying
    @Query("DELETE FROM Session s WHERE s.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
