package com.example.potholereporter.security;

import com.example.potholereporter.model.user.Role;
import com.example.potholereporter.model.user.UserAccount;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues and validates HS256 signed access tokens. The subject is the user
 * id; e-mail and role travel as claims so requests need no user lookup.
 */
public class JwtTokenService {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenService.class);

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLE = "role";
    static final int MIN_SECRET_BYTES = 32;

    private final Key key;
    private final String issuer;
    private final Duration ttl;
    private final Clock clock;

    public JwtTokenService(String secret, String issuer, Duration ttl, Clock clock) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("pothole.security.jwt-secret is not set; provide it through JWT_SECRET");
        }
        if (secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("pothole.security.jwt-secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalStateException("pothole.security.token-ttl must be positive");
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.issuer = issuer;
        this.ttl = ttl;
        this.clock = clock;
    }

    public IssuedToken issue(UserAccount account) {
        Instant issuedAt = Instant.now(clock);
        Instant expiresAt = issuedAt.plus(ttl);
        String token = Jwts.builder()
                .setId(UUID.randomUUID().toString())
                .setSubject(account.id())
                .setIssuer(issuer)
                .claim(CLAIM_EMAIL, account.email())
                .claim(CLAIM_ROLE, account.role().label())
                .setIssuedAt(Date.from(issuedAt))
                .setExpiration(Date.from(expiresAt))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
        return new IssuedToken(token, expiresAt);
    }

    /**
     * @return the user the token was issued to, or empty when the token is
     * malformed, expired, from another issuer or badly signed
     */
    public Optional<AuthenticatedUser> parse(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(key)
                    .requireIssuer(issuer)
                    .setClock(() -> Date.from(Instant.now(clock)))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                log.debug("Rejected token without subject");
                return Optional.empty();
            }
            Role role = Role.fromLabel(claims.get(CLAIM_ROLE, String.class));
            return Optional.of(new AuthenticatedUser(subject, claims.get(CLAIM_EMAIL, String.class), role));
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("Rejected bearer token: {}", ex.getMessage());
            return Optional.empty();
        }
    }
}
