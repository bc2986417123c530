package com.portray.portal.features.users.app;

import com.portray.portal.common.exception.ConflictException;
import com.portray.portal.common.exception.NotFoundException;
import com.portray.portal.common.security.UserRole;
import com.portray.portal.features.audit.app.AuditService;
import com.portray.portal.features.audit.app.UserSnapshot;
import com.portray.portal.features.auth.api.dto.UserView;
import com.portray.portal.features.auth.app.SessionService;
import com.portray.portal.features.auth.domain.User;
import com.portray.portal.features.auth.domain.UserRepository;
import com.portray.portal.features.users.api.dto.CreateUserRequest;
import com.portray.portal.features.users.api.dto.UpdateUserRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Account administration performed by a SystemAdmin. Every change is written to the audit trail.
 */
@Service
public class UserAdminService {

    private static final Logger log = LoggerFactory.getLogger(UserAdminService.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final SessionService sessionService;
    private final AuditService auditService;

    public UserAdminService(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            SessionService sessionService,
            AuditService auditService) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.sessionService = sessionService;
        this.auditService = auditService;
    }

    @Transactional(readOnly = true)
    public List<UserView> list() {
        return userRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(UserView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public UserView get(String userId) {
        return UserView.from(load(userId));
    }

    @Transactional
    public UserView create(CreateUserRequest request, String performedBy) {
        if (userRepository.existsByEmail(request.email())) {
            throw new ConflictException("A user with this email already exists");
        }

        User user = new User(
                User.newId(),
                request.email(),
                passwordEncoder.encode(request.password()),
                request.firstName(),
                request.lastName(),
                request.role());
        user.updateProfile(user.getEmail(), user.getFirstName(), user.getLastName(),
                request.userType(), request.portId(), request.terminalIds());
        userRepository.save(user);

        auditService.logUserCreation(user.getUserId(), performedBy, UserSnapshot.of(user));
        log.info("User {} created by {}", user.getUserId(), performedBy);
        return UserView.from(user);
    }

    @Transactional
    public UserView update(String userId, UpdateUserRequest request, String performedBy) {
        User user = load(userId);
        UserSnapshot before = UserSnapshot.of(user);

        String email = request.email() != null ? request.email() : user.getEmail();
        if (!email.equals(user.getEmail()) && userRepository.existsByEmail(email)) {
            throw new ConflictException("A user with this email already exists");
        }

        user.updateProfile(
                email,
                request.firstName() != null ? request.firstName() : user.getFirstName(),
                request.lastName() != null ? request.lastName() : user.getLastName(),
                request.userType() != null ? request.userType() : user.getUserType(),
                request.portId() != null ? request.portId() : user.getPortId(),
                request.terminalIds() != null ? request.terminalIds() : user.getTerminalIds());
        if (request.password() != null) {
            user.changePassword(passwordEncoder.encode(request.password()));
        }
        userRepository.save(user);

        auditService.logUserUpdate(userId, performedBy, before, UserSnapshot.of(user));
        return UserView.from(user);
    }

    @Transactional
    public UserView changeRole(String userId, UserRole role, String performedBy) {
        User user = load(userId);
        UserRole previous = user.getRole();
        if (previous == role) {
            return UserView.from(user);
        }

        user.changeRole(role);
        userRepository.save(user);

        auditService.logUserRoleChange(userId, performedBy, previous, role);
        log.info("User {} role changed from {} to {} by {}", userId, previous, role, performedBy);
        return UserView.from(user);
    }

    /**
     * Flips the active flag. Deactivating also ends every session of the user.
     */
    @Transactional
    public UserView toggleStatus(String userId, String performedBy) {
        User user = load(userId);
        if (userId.equals(performedBy)) {
            throw new IllegalArgumentException("You cannot change the status of your own account");
        }
        boolean previous = user.isActive();

        user.toggleActive();
        userRepository.save(user);
        if (!user.isActive()) {
            sessionService.revokeAll(userId);
        }

        auditService.logUserStatusChange(userId, performedBy, previous, user.isActive());
        return UserView.from(user);
    }

    @Transactional
    public void delete(String userId, String performedBy) {
        if (userId.equals(performedBy)) {
            throw new IllegalArgumentException("You cannot delete your own account");
        }
        User user = load(userId);
        UserSnapshot snapshot = UserSnapshot.of(user);

        sessionService.revokeAll(userId);
        userRepository.delete(user);

        auditService.logUserDeletion(userId, performedBy, snapshot);
        log.info("User {} deleted by {}", userId, performedBy);
    }

    private User load(String userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User not found: " + userId));
    }
}
