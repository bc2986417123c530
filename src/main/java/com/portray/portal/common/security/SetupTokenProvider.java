package com.portray.portal.common.security;

import com.portray.portal.common.config.PortalProperties;
import com.portray.portal.common.exception.InvalidTokenException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

/**
 * Signs and checks the one-time token handed out after contact verification.
 * The token only authorizes setting the first password of the user in its subject.
 */
@Component
public class SetupTokenProvider {

    static final String PURPOSE_CLAIM = "purpose";
    static final String PURPOSE = "password_setup";

    private final SecretKey secretKey;
    private final PortalProperties.SetupToken settings;
    private final Clock clock;

    public SetupTokenProvider(PortalProperties properties, Clock clock) {
        this.settings = properties.getSetupToken();
        if (settings.getSecret() == null || settings.getSecret().length() < 32) {
            throw new IllegalStateException("app.portal.setup-token.secret must be at least 32 characters");
        }
        this.secretKey = Keys.hmacShaKeyFor(settings.getSecret().getBytes(StandardCharsets.UTF_8));
        this.clock = clock;
    }

    public String generateToken(String userId) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(userId)
                .claim(PURPOSE_CLAIM, PURPOSE)
                .issuer(settings.getIssuer())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(settings.getTtl())))
                .signWith(secretKey, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * @return the user id the token was issued for
     * @throws InvalidTokenException when the token is malformed, expired, foreign or for another purpose
     */
    public String validateToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .requireIssuer(settings.getIssuer())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            if (!PURPOSE.equals(claims.get(PURPOSE_CLAIM, String.class))) {
                throw new InvalidTokenException("Invalid or expired password setup token");
            }
            return claims.getSubject();
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid or expired password setup token");
        }
    }
}
