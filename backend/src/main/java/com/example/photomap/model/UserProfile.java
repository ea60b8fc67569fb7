package com.example.photomap.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A registered person. Email and WebAuthn user handle are both unique; the admin flag is set
 * once, on the identity whose registration wins the first-admin claim, and never changes afterwards.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document("user_profiles")
public class UserProfile {
    @Id
    private String id;

    @Indexed(unique = true)
    private String email;

    /** Base64url of the 32 random bytes handed to authenticators as the user id. */
    @Indexed(unique = true)
    private String webauthnUserHandle;

    private String displayName;
    private boolean admin;
    private Instant createdAt;
    private Instant updatedAt;
}
