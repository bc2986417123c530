package com.portray.portal.features.auth.api.dto;

import com.portray.portal.common.security.UserRole;
import com.portray.portal.features.auth.domain.User;

import java.time.Instant;
import java.util.List;

/**
 * Outward view of a user. Never carries the password hash.
 */
public record UserView(
    String id,
    String email,
    String firstName,
    String lastName,
    UserRole role,
    String userType,
    Long portId,
    List<Long> terminalIds,
    boolean isActive,
    Instant lastLogin,
    Instant createdAt
) {
    public static UserView from(User user) {
        return new UserView(
            user.getUserId(),
            user.getEmail(),
            user.getFirstName(),
            user.getLastName(),
            user.getRole(),
            user.getUserType(),
            user.getPortId(),
            user.getTerminalIds(),
            user.isActive(),
            user.getLastLogin(),
            user.getCreatedAt()
        );
    }
}
