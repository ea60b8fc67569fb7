package com.example.photomap.security;

import com.example.photomap.model.UserProfile;
import com.example.photomap.support.MutableClock;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtServiceTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";

    private final MutableClock clock = new MutableClock();

    @Test
    void roundTripsIdentityClaims() {
        JwtService service = new JwtService(SECRET, 60, clock);
        UserProfile user = UserProfile.builder().id("user-1").email("user@example.com").admin(true).build();

        AuthenticatedUser principal = service.validate(service.generate(user));

        assertThat(principal).isEqualTo(new AuthenticatedUser("user-1", "user@example.com", true));
        assertThat(service.getExpiry()).isEqualTo(Duration.ofMinutes(60));
    }

    @Test
    void expiredTokenIsRejected() {
        JwtService service = new JwtService(SECRET, 60, clock);
        String token = service.generate(UserProfile.builder().id("user-1").email("user@example.com").build());

        clock.advance(Duration.ofMinutes(61));

        assertThatThrownBy(() -> service.validate(token)).isInstanceOf(ExpiredJwtException.class);
    }

    @Test
    void tokenSignedWithAnotherSecretIsRejected() {
        JwtService issuer = new JwtService("another-secret-of-at-least-32-bytes!", 60, clock);
        JwtService service = new JwtService(SECRET, 60, clock);
        String token = issuer.generate(UserProfile.builder().id("user-1").email("user@example.com").build());

        assertThatThrownBy(() -> service.validate(token)).isInstanceOf(JwtException.class);
    }

    @Test
    void shortSecretFailsFast() {
        assertThatThrownBy(() -> new JwtService("too-short", 60, clock))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new JwtService(null, 60, clock))
                .isInstanceOf(IllegalStateException.class);
    }
}
