package com.example.photomap.repo;

import com.example.photomap.model.Invite;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface InviteRepository {

    /**
     * Fails with {@link org.springframework.dao.DuplicateKeyException} on a taken code or when
     * another invite holds the same {@code activeEmail}.
     */
    Invite insert(Invite invite);

    Optional<Invite> findById(String id);

    Optional<Invite> findByCode(String code);

    /** Frees the live-invite slot of {@code email} held by invites that expired unused. */
    void releaseExpiredSlots(String email, Instant now);

    /** Whether some invite currently holds the live-invite slot of {@code email}. */
    boolean isSlotTaken(String email);

    /** Newest first. */
    List<Invite> findAll();

    /**
     * Marks a pending invite as used by {@code userId}. The update only matches an unused,
     * unrevoked, unexpired invite whose email is unset or equal to {@code email}.
     */
    Optional<Invite> consume(String code, String email, String userId, Instant now);

    /** Marks a pending invite used and revoked, without a consumer. */
    boolean revoke(String id, Instant now);
}
