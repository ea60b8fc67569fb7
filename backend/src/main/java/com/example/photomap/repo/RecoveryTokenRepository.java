package com.example.photomap.repo;

import com.example.photomap.model.RecoveryToken;

import java.time.Instant;
import java.util.Optional;

public interface RecoveryTokenRepository {

    RecoveryToken insert(RecoveryToken token);

    /** Removes tokens of the identity that are neither used nor locked. */
    long invalidateActive(String userId);

    /** Newest unused, unexpired token of the identity, locked ones included. */
    Optional<RecoveryToken> findLatestUnused(String userId, Instant now);

    /**
     * Atomically adds one failed attempt to an unused token still below {@code maxAttempts}
     * and marks it locked once the counter reaches the limit. Returns the token after the
     * update, or empty when the token was already used or exhausted.
     */
    Optional<RecoveryToken> recordFailedAttempt(String tokenId, int maxAttempts, Instant now);

    /**
     * Conditional used-mark; exactly one concurrent caller gets {@code true}. A token whose
     * counter reached {@code maxAttempts} never matches, lock marker or not.
     */
    boolean claim(String tokenId, int maxAttempts, Instant now);
}
