package com.example.photomap.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document("recovery_tokens")
public class RecoveryToken {
    @Id
    private String id;

    @Indexed
    private String userId;

    /** SHA-256 of the six digit code, base64url. */
    private String codeHash;

    private Instant expiresAt;
    private int attempts;
    private Instant lockedAt;
    private Instant usedAt;
    private Instant createdAt;

    public boolean isLocked() {
        return lockedAt != null;
    }

    /** Locked, or out of attempts even if the lock marker has not been written yet. */
    public boolean isExhausted(int maxAttempts) {
        return lockedAt != null || attempts >= maxAttempts;
    }
}
