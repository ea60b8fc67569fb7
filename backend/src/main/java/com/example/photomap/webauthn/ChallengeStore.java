package com.example.photomap.webauthn;

import java.util.Optional;

/**
 * Short lived WebAuthn challenges, one per email. A later {@link #put} for the same email
 * replaces the earlier challenge, whatever its purpose.
 */
public interface ChallengeStore {

    void put(String email, PendingChallenge challenge);

    /** The challenge for {@code email}, if one exists and has not expired. */
    Optional<PendingChallenge> take(String email);

    void clear(String email);

    /** Removes expired entries; returns how many were removed. */
    int purgeExpired();
}
