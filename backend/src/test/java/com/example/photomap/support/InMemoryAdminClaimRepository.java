package com.example.photomap.support;

import com.example.photomap.repo.AdminClaimRepository;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

public class InMemoryAdminClaimRepository implements AdminClaimRepository {

    private final AtomicReference<String> claimant = new AtomicReference<>();

    @Override
    public boolean tryClaim(String claimantId, Instant now) {
        return claimant.compareAndSet(null, claimantId);
    }

    public String claimant() {
        return claimant.get();
    }
}
