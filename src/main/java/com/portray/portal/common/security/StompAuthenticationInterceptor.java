package com.portray.portal.common.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * STOMP channel interceptor that authenticates WebSocket connections with the same
 * bearer session token used by the REST API.
 *
 * The client sends the token in the STOMP CONNECT frame:
 *   CONNECT
 *   Authorization: Bearer <token>
 *
 * The authenticated user's id becomes the STOMP user name, so per-user queues
 * (/user/queue/notifications) resolve to the right session.
 */
@Component
public class StompAuthenticationInterceptor implements ChannelInterceptor {

    private static final Logger log = LoggerFactory.getLogger(StompAuthenticationInterceptor.class);

    private final SessionPrincipalResolver principalResolver;

    public StompAuthenticationInterceptor(SessionPrincipalResolver principalResolver) {
        this.principalResolver = principalResolver;
    }

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);

        if (accessor == null || !StompCommand.CONNECT.equals(accessor.getCommand())) {
            return message;
        }

        List<String> authHeaders = accessor.getNativeHeader("Authorization");
        String token = authHeaders == null || authHeaders.isEmpty()
                ? null
                : OpaqueTokens.bearerToken(authHeaders.get(0));

        if (token == null) {
            log.debug("No bearer token in STOMP CONNECT frame");
            return message;
        }

        principalResolver.resolvePrincipal(token).ifPresentOrElse(principal -> {
            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(principal, null, principal.getAuthorities()) {
                        @Override
                        public String getName() {
                            return principal.getUserId();
                        }
                    };
            accessor.setUser(authentication);
            log.debug("Authenticated WebSocket connection for user: {}", principal.getUserId());
        }, () -> log.warn("Rejected session token in STOMP CONNECT frame"));

        return message;
    }
}
