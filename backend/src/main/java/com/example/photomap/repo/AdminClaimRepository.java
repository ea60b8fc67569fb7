package com.example.photomap.repo;

import java.time.Instant;

public interface AdminClaimRepository {

    /**
     * Returns {@code true} for exactly one caller over the lifetime of the database. Runs inside
     * the transaction that creates the claimant's identity, so a rolled back registration
     * leaves the claim free.
     */
    boolean tryClaim(String claimantId, Instant now);
}
