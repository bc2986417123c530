package com.portray.portal.common.security;

import java.util.Optional;

/**
 * Turns a raw bearer token into the principal of a live session.
 */
public interface SessionPrincipalResolver {

    Optional<UserPrincipal> resolvePrincipal(String token);
}
