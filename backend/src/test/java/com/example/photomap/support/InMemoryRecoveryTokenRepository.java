package com.example.photomap.support;

import com.example.photomap.model.RecoveryToken;
import com.example.photomap.repo.RecoveryTokenRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryRecoveryTokenRepository implements RecoveryTokenRepository {

    private final Map<String, RecoveryToken> store = new ConcurrentHashMap<>();

    @Override
    public RecoveryToken insert(RecoveryToken token) {
        store.put(token.getId(), token.toBuilder().build());
        return token;
    }

    @Override
    public long invalidateActive(String userId) {
        List<String> active = store.values().stream()
                .filter(token -> token.getUserId().equals(userId))
                .filter(token -> token.getUsedAt() == null && token.getLockedAt() == null)
                .map(RecoveryToken::getId)
                .toList();
        active.forEach(store::remove);
        return active.size();
    }

    @Override
    public Optional<RecoveryToken> findLatestUnused(String userId, Instant now) {
        return store.values().stream()
                .filter(token -> token.getUserId().equals(userId))
                .filter(token -> token.getUsedAt() == null && token.getExpiresAt().isAfter(now))
                .max(Comparator.comparing(RecoveryToken::getCreatedAt))
                .map(token -> token.toBuilder().build());
    }

    @Override
    public synchronized Optional<RecoveryToken> recordFailedAttempt(String tokenId, int maxAttempts, Instant now) {
        RecoveryToken token = store.get(tokenId);
        if (token == null || token.getUsedAt() != null || token.isExhausted(maxAttempts)) {
            return Optional.empty();
        }
        token.setAttempts(token.getAttempts() + 1);
        if (token.getAttempts() >= maxAttempts) {
            token.setLockedAt(now);
        }
        return Optional.of(token.toBuilder().build());
    }

    @Override
    public synchronized boolean claim(String tokenId, int maxAttempts, Instant now) {
        RecoveryToken token = store.get(tokenId);
        if (token == null || token.getUsedAt() != null || token.isExhausted(maxAttempts)
                || !token.getExpiresAt().isAfter(now)) {
            return false;
        }
        token.setUsedAt(now);
        return true;
    }

    /** Overwrites the stored state, for setting up half-finished concurrent updates. */
    public void replace(RecoveryToken token) {
        store.put(token.getId(), token.toBuilder().build());
    }

    public List<RecoveryToken> findAll() {
        return store.values().stream().map(token -> token.toBuilder().build()).toList();
    }
}
