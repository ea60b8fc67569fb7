package com.example.photomap.webauthn;

import com.example.photomap.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryChallengeStoreTest {

    private MutableClock clock;
    private InMemoryChallengeStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        WebAuthnProperties properties = new WebAuthnProperties();
        properties.setRelyingPartyId("localhost");
        properties.setRelyingPartyName("Photo Map");
        properties.setOrigins(List.of("http://localhost:5173"));
        properties.setChallengeTtl(Duration.ofMinutes(5));
        store = new InMemoryChallengeStore(properties, clock);
    }

    @Test
    void keysIgnoreCaseAndSurroundingWhitespace() {
        store.put("User@Example.com", PendingChallenge.login("request", "user-1"));

        assertThat(store.take(" user@example.com ")).map(PendingChallenge::userId).contains("user-1");
    }

    @Test
    void laterPutReplacesEarlierChallenge() {
        store.put("user@example.com", PendingChallenge.login("first", "user-1"));
        store.put("user@example.com", new PendingChallenge(ChallengePurpose.REGISTRATION, "second", null,
                "handle", null, null));

        assertThat(store.take("user@example.com"))
                .hasValueSatisfying(challenge -> {
                    assertThat(challenge.requestJson()).isEqualTo("second");
                    assertThat(challenge.isFor(ChallengePurpose.REGISTRATION)).isTrue();
                });
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void challengeExpiresAfterTtl() {
        store.put("user@example.com", PendingChallenge.login("request", "user-1"));

        clock.advance(Duration.ofMinutes(4));
        assertThat(store.take("user@example.com")).isPresent();

        clock.advance(Duration.ofMinutes(1));
        assertThat(store.take("user@example.com")).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    void purgeRemovesOnlyExpiredEntries() {
        store.put("old@example.com", PendingChallenge.login("old", "user-1"));
        clock.advance(Duration.ofMinutes(3));
        store.put("new@example.com", PendingChallenge.login("new", "user-2"));
        clock.advance(Duration.ofMinutes(3));

        assertThat(store.purgeExpired()).isEqualTo(1);
        assertThat(store.take("old@example.com")).isEmpty();
        assertThat(store.take("new@example.com")).isPresent();
    }

    @Test
    void clearDropsTheChallenge() {
        store.put("user@example.com", PendingChallenge.login("request", "user-1"));
        store.clear("USER@example.com");

        assertThat(store.take("user@example.com")).isEmpty();
    }
}
