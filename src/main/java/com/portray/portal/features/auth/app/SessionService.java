package com.portray.portal.features.auth.app;

import com.portray.portal.common.config.PortalProperties;
import com.portray.portal.common.security.OpaqueTokens;
import com.portray.portal.common.security.SessionPrincipalResolver;
import com.portray.portal.common.security.UserPrincipal;
import com.portray.portal.features.auth.domain.Session;
import com.portray.portal.features.auth.domain.SessionRepository;
import com.portray.portal.features.auth.domain.User;
import com.portray.portal.features.auth.domain.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Issues, resolves and revokes bearer sessions.
 * Expiry is checked lazily on every read; an expired row found on read is deleted on the spot.
 */
@Service
public class SessionService implements SessionPrincipalResolver {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final SessionRepository sessionRepository;
    private final UserRepository userRepository;
    private final PortalProperties.Session settings;
    private final Clock clock;

    public SessionService(
            SessionRepository sessionRepository,
            UserRepository userRepository,
            PortalProperties properties,
            Clock clock) {
        this.sessionRepository = sessionRepository;
        this.userRepository = userRepository;
        this.settings = properties.getSession();
        this.clock = clock;
    }

    @Transactional
    public IssuedSession createSession(String userId, boolean rememberMe) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(rememberMe ? settings.getRememberMeTtl() : settings.getTtl());
        String token = OpaqueTokens.newToken();

        Session session = sessionRepository.save(
                new Session(userId, OpaqueTokens.digest(token), now, expiresAt));
        log.debug("Created session for user {} expiring at {}", userId, expiresAt);
        return new IssuedSession(token, session.getUserId(), session.getExpiresAt());
    }

    @Transactional
    public Optional<Session> resolveSession(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        Optional<Session> found = sessionRepository.findByTokenHash(OpaqueTokens.digest(token));
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Session session = found.get();
        if (!session.isLiveAt(clock.instant())) {
            sessionRepository.delete(session);
            log.debug("Discarded expired session {} of user {}", session.getId(), session.getUserId());
            return Optional.empty();
        }
        return Optional.of(session);
    }

    @Override
    @Transactional
    public Optional<UserPrincipal> resolvePrincipal(String token) {
        return resolveSession(token)
                .flatMap(session -> userRepository.findById(session.getUserId()))
                .filter(User::isActive)
                .map(user -> new UserPrincipal(user.getUserId(), user.getEmail(), user.getRole()));
    }

    @Transactional
    public void revoke(String token) {
        if (token != null) {
            sessionRepository.deleteByTokenHash(OpaqueTokens.digest(token));
        }
    }

    @Transactional
    public int revokeAll(String userId) {
        int removed = sessionRepository.deleteAllByUserId(userId);
        log.info("Revoked {} session(s) of user {}", removed, userId);
        return removed;
    }

    @Transactional
    public int purgeExpired() {
        return sessionRepository.deleteExpired(clock.instant());
    }

    public record IssuedSession(String token, String userId, Instant expiresAt) {}
}
