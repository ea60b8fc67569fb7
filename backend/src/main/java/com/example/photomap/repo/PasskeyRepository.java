package com.example.photomap.repo;

import com.example.photomap.model.Passkey;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PasskeyRepository {

    List<Passkey> findByUserId(String userId);

    Optional<Passkey> findByCredentialId(String credentialId);

    long countByUserId(String userId);

    /** Fails with {@link org.springframework.dao.DuplicateKeyException} on a known credential id. */
    Passkey insert(Passkey passkey);

    boolean recordUse(String credentialId, long signCount, Instant usedAt);

    boolean delete(String userId, String credentialId);

    long deleteByUserId(String userId);
}
