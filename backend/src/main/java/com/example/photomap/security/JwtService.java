package com.example.photomap.security;

import com.example.photomap.model.UserProfile;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and reads the bearer session token. Claims: {@code sub} identity id, {@code email},
 * {@code isAdmin}.
 */
@Service
public class JwtService {

    static final int MIN_SECRET_BYTES = 32;

    private final SecretKey key;
    private final Duration expiry;
    private final Clock clock;

    public JwtService(@Value("${app.jwt.secret}") String secret,
                      @Value("${app.jwt.expiry-minutes:10080}") long expiryMinutes,
                      Clock clock) {
        byte[] secretBytes = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
        if (secretBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("app.jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        this.key = Keys.hmacShaKeyFor(secretBytes);
        this.expiry = Duration.ofMinutes(Math.max(1, expiryMinutes));
        this.clock = clock;
    }

    public String generate(UserProfile user) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(user.getId())
                .claim("email", user.getEmail())
                .claim("isAdmin", user.isAdmin())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(expiry)))
                .signWith(key)
                .compact();
    }

    public AuthenticatedUser validate(String token) {
        Claims claims = Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()))
                .build()
                .parseSignedClaims(token)
                .getPayload();
        Boolean admin = claims.get("isAdmin", Boolean.class);
        return new AuthenticatedUser(claims.getSubject(), claims.get("email", String.class), Boolean.TRUE.equals(admin));
    }

    public Duration getExpiry() {
        return expiry;
    }
}
