package com.portray.portal.common.security;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SessionAuthenticationFilterTest {

    private SessionPrincipalResolver resolver;
    private SessionAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        resolver = mock(SessionPrincipalResolver.class);
        filter = new SessionAuthenticationFilter(resolver);
        SecurityContextHolder.clearContext();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    private static MockHttpServletRequest request(String authorization) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/auth/me");
        if (authorization != null) {
            request.addHeader("Authorization", authorization);
        }
        return request;
    }

    @Test
    @DisplayName("Live session token authenticates the request with the user's role")
    void authenticatesLiveSession() throws Exception {
        UserPrincipal principal = new UserPrincipal("user_1", "admin@example.com", UserRole.SYSTEM_ADMIN);
        when(resolver.resolvePrincipal("live-token")).thenReturn(Optional.of(principal));
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("Bearer live-token"), new MockHttpServletResponse(), chain);

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertNotNull(authentication);
        assertSame(principal, authentication.getPrincipal());
        assertTrue(authentication.getAuthorities().stream()
                .anyMatch(a -> a.getAuthority().equals("ROLE_SYSTEM_ADMIN")));
        assertNotNull(chain.getRequest());
    }

    @Test
    @DisplayName("Unknown or expired token leaves the request anonymous but still continues the chain")
    void unknownTokenStaysAnonymous() throws Exception {
        when(resolver.resolvePrincipal("stale")).thenReturn(Optional.empty());
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("Bearer stale"), new MockHttpServletResponse(), chain);

        assertNull(SecurityContextHolder.getContext().getAuthentication());
        assertNotNull(chain.getRequest());
    }

    @Test
    @DisplayName("Requests without a bearer header never hit the session store")
    void noHeader() throws Exception {
        filter.doFilter(request(null), new MockHttpServletResponse(), new MockFilterChain());
        filter.doFilter(request("Basic dXNlcjpwYXNz"), new MockHttpServletResponse(), new MockFilterChain());

        verify(resolver, never()).resolvePrincipal(anyString());
    }
}
