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

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document("authenticators")
public class Passkey {
    @Id
    private String id;

    @Indexed
    private String userId;

    /** Base64url credential id, the same value the browser reports as {@code credential.id}. */
    @Indexed(unique = true)
    private String credentialId;

    /** Base64url COSE-encoded public key. */
    private String publicKeyCose;

    private long signCount;
    private List<String> transports;
    private Instant createdAt;
    private Instant lastUsedAt;
}
