package com.portray.portal.common.security;

import com.portray.portal.common.config.PortalProperties;
import com.portray.portal.common.exception.InvalidTokenException;
import com.portray.portal.support.MutableClock;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

class SetupTokenProviderTest {

    private static final String SECRET = "unit-test-setup-token-secret-0123456789abcdef";
    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");

    private MutableClock clock;
    private SetupTokenProvider provider;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        provider = new SetupTokenProvider(properties(SECRET), clock);
    }

    private static PortalProperties properties(String secret) {
        PortalProperties properties = new PortalProperties();
        properties.getSetupToken().setSecret(secret);
        return properties;
    }

    @Test
    @DisplayName("Token validates to the user it was issued for")
    void roundTripsSubject() {
        String token = provider.generateToken("user_42");

        assertEquals("user_42", provider.validateToken(token));
    }

    @Test
    @DisplayName("Token stops validating after its TTL")
    void expires() {
        String token = provider.generateToken("user_42");

        clock.advance(Duration.ofHours(24).plusSeconds(1));

        assertThrows(InvalidTokenException.class, () -> provider.validateToken(token));
    }

    @Test
    @DisplayName("Token signed with another key is rejected")
    void foreignSignature() {
        SetupTokenProvider other = new SetupTokenProvider(
                properties("another-secret-that-is-also-long-enough-0123"), clock);

        String token = other.generateToken("user_42");

        assertThrows(InvalidTokenException.class, () -> provider.validateToken(token));
    }

    @Test
    @DisplayName("Correctly signed token without the setup purpose is rejected")
    void wrongPurpose() {
        String token = Jwts.builder()
                .subject("user_42")
                .issuer("portray")
                .issuedAt(Date.from(NOW))
                .expiration(Date.from(NOW.plus(Duration.ofHours(1))))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)), Jwts.SIG.HS256)
                .compact();

        assertThrows(InvalidTokenException.class, () -> provider.validateToken(token));
    }

    @Test
    @DisplayName("Garbage is rejected")
    void malformed() {
        assertThrows(InvalidTokenException.class, () -> provider.validateToken("not-a-jwt"));
    }

    @Test
    @DisplayName("Short secrets are refused at startup")
    void shortSecret() {
        assertThrows(IllegalStateException.class, () -> new SetupTokenProvider(properties("too-short"), clock));
    }
}
