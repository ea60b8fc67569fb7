package com.example.photomap.repo;

import com.example.photomap.model.UserProfile;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface UserProfileRepository {

    Optional<UserProfile> findById(String id);

    /** Email must already be normalised (trimmed, lower case). */
    Optional<UserProfile> findByEmail(String email);

    /** Every identity ordered by email. */
    List<UserProfile> findAll();

    long count();

    /** Fails with {@link org.springframework.dao.DuplicateKeyException} on a taken email or handle. */
    UserProfile insert(UserProfile profile);

    /**
     * Bumps {@code updatedAt}. Inside a transaction this write-locks the identity document so
     * concurrent passkey changes for the same identity serialise.
     */
    boolean touch(String id, Instant now);

    /** Sets the admin flag; only the winner of the first-admin claim gets here. */
    void markAdmin(String id, Instant now);
}
