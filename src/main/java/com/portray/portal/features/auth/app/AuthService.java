package com.portray.portal.features.auth.app;

import com.portray.portal.common.exception.AuthenticationFailedException;
import com.portray.portal.common.exception.NotFoundException;
import com.portray.portal.common.security.UserRole;
import com.portray.portal.features.audit.app.AuditService;
import com.portray.portal.features.auth.api.dto.LoginRequest;
import com.portray.portal.features.auth.api.dto.LoginResponse;
import com.portray.portal.features.auth.api.dto.RefreshResponse;
import com.portray.portal.features.auth.api.dto.UserView;
import com.portray.portal.features.auth.domain.Session;
import com.portray.portal.features.auth.domain.User;
import com.portray.portal.features.auth.domain.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);
    private static final String INVALID_CREDENTIALS = "Invalid email or password";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final SessionService sessionService;
    private final AuditService auditService;
    private final Clock clock;

    public AuthService(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            SessionService sessionService,
            AuditService auditService,
            Clock clock) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.sessionService = sessionService;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * Checks credentials. Unknown email, wrong password, inactive account and an account
     * without a password all fail with the same message.
     */
    @Transactional(readOnly = true)
    public User authenticate(String email, String password) {
        User user = userRepository.findByEmail(email)
                .orElseThrow(() -> new AuthenticationFailedException(INVALID_CREDENTIALS));

        if (!user.isActive() || !user.isPasswordSet()
                || !passwordEncoder.matches(password, user.getPasswordHash())) {
            throw new AuthenticationFailedException(INVALID_CREDENTIALS);
        }
        return user;
    }

    @Transactional
    public LoginResponse login(LoginRequest request) {
        User user = authenticate(request.email(), request.password());

        user.recordLogin(clock.instant());
        userRepository.save(user);

        SessionService.IssuedSession session =
                sessionService.createSession(user.getUserId(), Boolean.TRUE.equals(request.rememberMe()));
        auditService.logLogin(user.getUserId());
        log.info("User {} logged in", user.getUserId());

        return new LoginResponse(UserView.from(user), session.token(), session.expiresAt(),
                redirectPathFor(user.getRole()));
    }

    @Transactional
    public void logout(String token) {
        sessionService.revoke(token);
    }

    @Transactional(readOnly = true)
    public UserView currentUser(String userId) {
        return userRepository.findById(userId)
                .map(UserView::from)
                .orElseThrow(() -> new NotFoundException("User not found: " + userId));
    }

    /**
     * Swaps a live session for a fresh one; the old token stops working immediately.
     */
    @Transactional
    public RefreshResponse refresh(String token) {
        Session current = sessionService.resolveSession(token)
                .orElseThrow(() -> new AuthenticationFailedException("Invalid or expired token"));

        SessionService.IssuedSession next = sessionService.createSession(current.getUserId(), false);
        sessionService.revoke(token);
        return new RefreshResponse(next.token(), next.expiresAt());
    }

    static String redirectPathFor(UserRole role) {
        return role == UserRole.SYSTEM_ADMIN ? "/portal/welcome" : "/dashboard";
    }
}
