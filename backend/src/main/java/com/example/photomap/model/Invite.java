package com.example.photomap.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * A one-shot registration code bound to an email, a role and a set of trips. The trip
 * bindings live inside the document so an invite is written and consumed atomically.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document("invites")
public class Invite {
    @Id
    private String id;

    @Indexed(unique = true)
    private String code;

    private String createdByUserId;

    @Indexed
    private String email;

    /**
     * Copy of {@code email} while the invite may still be used. The unique sparse index on it
     * admits one live invite per email; consuming or revoking the invite unsets it, and the next
     * create for that email unsets it on expired invites.
     */
    @Indexed(unique = true, sparse = true)
    private String activeEmail;

    private TripRole role;
    private List<String> tripIds;
    private Instant expiresAt;
    private Instant usedAt;
    private String usedByUserId;
    private Instant revokedAt;
    private Instant createdAt;
    private Instant updatedAt;

    public InviteStatus statusAt(Instant now) {
        if (revokedAt != null) {
            return InviteStatus.REVOKED;
        }
        if (usedAt != null) {
            return InviteStatus.USED;
        }
        if (expiresAt == null || !expiresAt.isAfter(now)) {
            return InviteStatus.EXPIRED;
        }
        return InviteStatus.PENDING;
    }

    public boolean isUsableAt(Instant now) {
        return statusAt(now) == InviteStatus.PENDING;
    }
}
