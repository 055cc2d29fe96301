package com.bank.mpin.service;

import com.bank.mpin.config.SessionConfig;
import com.bank.mpin.model.IssuedSession;
import com.bank.mpin.model.SessionClaims;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Date;
import java.util.Optional;

/**
 * Issues and verifies HS256-signed session tokens bound to one identity.
 *
 * Tokens carry the identity id as subject plus the phone, and are only
 * accepted back with the configured issuer and audience before expiry.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private static final String PHONE_CLAIM = "phone";
    private static final int GENERATED_SECRET_BYTES = 64;

    private final SessionConfig sessionConfig;
    private final Clock clock;
    private final SecretKey signingKey;

    public SessionService(SessionConfig sessionConfig, Clock clock) {
        this.sessionConfig = sessionConfig;
        this.clock = clock;
        this.signingKey = resolveKey(sessionConfig.getSecret());
    }

    public IssuedSession issue(String identityId, String phone) {
        long now = clock.millis();
        // JWT times have second precision
        long expiresAt = (now + sessionConfig.getTtlMillis()) / 1000 * 1000;

        String token = Jwts.builder()
                .setSubject(identityId)
                .claim(PHONE_CLAIM, phone)
                .setIssuer(sessionConfig.getIssuer())
                .setAudience(sessionConfig.getAudience())
                .setIssuedAt(new Date(now))
                .setExpiration(new Date(expiresAt))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();

        return new IssuedSession(token, expiresAt);
    }

    /**
     * @return the token's claims, or empty if the token is malformed, forged, expired
     *         or was issued for another issuer or audience
     */
    public Optional<SessionClaims> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }

        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .requireIssuer(sessionConfig.getIssuer())
                    .requireAudience(sessionConfig.getAudience())
                    .setClock(() -> new Date(clock.millis()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();

            return Optional.of(new SessionClaims(
                    claims.getSubject(),
                    claims.get(PHONE_CLAIM, String.class),
                    claims.getIssuedAt().getTime(),
                    claims.getExpiration().getTime()));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected session token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static SecretKey resolveKey(String secret) {
        if (secret == null || secret.isBlank()) {
            log.warn("No auth.session.secret configured; using a random key. Sessions will not survive a restart.");
            byte[] random = new byte[GENERATED_SECRET_BYTES];
            new SecureRandom().nextBytes(random);
            return Keys.hmacShaKeyFor(random);
        }
        // Throws WeakKeyException below 256 bits
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }
}
