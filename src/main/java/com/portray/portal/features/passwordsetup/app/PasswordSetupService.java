package com.portray.portal.features.passwordsetup.app;

import com.portray.portal.common.exception.InvalidTokenException;
import com.portray.portal.common.exception.NotFoundException;
import com.portray.portal.common.security.SetupTokenProvider;
import com.portray.portal.features.audit.app.AuditService;
import com.portray.portal.features.auth.api.dto.LoginResponse;
import com.portray.portal.features.auth.api.dto.UserView;
import com.portray.portal.features.auth.app.SessionService;
import com.portray.portal.features.auth.domain.User;
import com.portray.portal.features.auth.domain.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * First password of a contact-provisioned account. Completing setup activates the account
 * and signs the user in.
 */
@Service
public class PasswordSetupService {

    private static final Logger log = LoggerFactory.getLogger(PasswordSetupService.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final SetupTokenProvider setupTokenProvider;
    private final SessionService sessionService;
    private final AuditService auditService;
    private final Clock clock;

    public PasswordSetupService(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            SetupTokenProvider setupTokenProvider,
            SessionService sessionService,
            AuditService auditService,
            Clock clock) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.setupTokenProvider = setupTokenProvider;
        this.sessionService = sessionService;
        this.auditService = auditService;
        this.clock = clock;
    }

    @Transactional
    public LoginResponse setupPassword(String userId, String password, String setupToken) {
        String tokenSubject = setupTokenProvider.validateToken(setupToken);
        if (!tokenSubject.equals(userId)) {
            log.warn("Password setup token for {} presented for user {}", tokenSubject, userId);
            throw new InvalidTokenException("Invalid or expired password setup token");
        }

        User user = userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User not found: " + userId));
        if (user.isPasswordSet()) {
            throw new IllegalStateException("Password has already been set for this account");
        }

        user.completePasswordSetup(passwordEncoder.encode(password), clock.instant());
        userRepository.save(user);

        SessionService.IssuedSession session = sessionService.createSession(userId, false);
        auditService.logPasswordSetup(userId);
        log.info("Password set up for user {}", userId);

        return new LoginResponse(UserView.from(user), session.token(), session.expiresAt(), "/dashboard");
    }
}
