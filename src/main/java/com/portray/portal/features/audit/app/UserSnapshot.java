package com.portray.portal.features.audit.app;

import com.portray.portal.features.auth.domain.User;

import java.util.List;

/**
 * The user fields tracked by the audit trail, captured at one point in time.
 */
public record UserSnapshot(
    String email,
    String firstName,
    String lastName,
    String userType,
    String role,
    Long portId,
    List<Long> terminalIds,
    boolean isActive
) {
    public static UserSnapshot of(User user) {
        return new UserSnapshot(
            user.getEmail(),
            user.getFirstName(),
            user.getLastName(),
            user.getUserType(),
            user.getRole().getLabel(),
            user.getPortId(),
            user.getTerminalIds(),
            user.isActive()
        );
    }
}
