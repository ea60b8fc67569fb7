package com.example.photomap.webauthn;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process local challenge store. Running more than one instance of the service needs a shared
 * implementation of {@link ChallengeStore} instead, or sticky routing per email.
 */
@Component
public class InMemoryChallengeStore implements ChallengeStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryChallengeStore.class);

    private final Duration ttl;
    private final Clock clock;
    private final ConcurrentMap<String, StoredChallenge> challenges = new ConcurrentHashMap<>();

    public InMemoryChallengeStore(WebAuthnProperties properties, Clock clock) {
        this.ttl = properties.getChallengeTtl();
        this.clock = clock;
    }

    @Override
    public void put(String email, PendingChallenge challenge) {
        challenges.put(key(email), new StoredChallenge(challenge, clock.instant().plus(ttl)));
    }

    @Override
    public Optional<PendingChallenge> take(String email) {
        StoredChallenge stored = challenges.get(key(email));
        if (stored == null) {
            return Optional.empty();
        }
        if (!stored.expiresAt().isAfter(clock.instant())) {
            challenges.remove(key(email), stored);
            return Optional.empty();
        }
        return Optional.of(stored.challenge());
    }

    @Override
    public void clear(String email) {
        challenges.remove(key(email));
    }

    @Scheduled(fixedDelayString = "${app.webauthn.challenge-sweep-interval-ms:60000}")
    public void sweep() {
        purgeExpired();
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = challenges.size();
        challenges.values().removeIf(stored -> !stored.expiresAt().isAfter(now));
        int removed = Math.max(0, before - challenges.size());
        if (removed > 0) {
            log.debug("Purged {} expired WebAuthn challenges", removed);
        }
        return removed;
    }

    int size() {
        return challenges.size();
    }

    private String key(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    private record StoredChallenge(PendingChallenge challenge, Instant expiresAt) { }
}
