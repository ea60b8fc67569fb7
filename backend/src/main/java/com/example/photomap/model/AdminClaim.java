package com.example.photomap.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Sentinel document. Its fixed id turns "who becomes the first admin" into a single insert
 * that the primary-key index lets exactly one writer win.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document("admin_claims")
public class AdminClaim {
    public static final String FIRST_ADMIN = "first-admin";

    @Id
    private String id;

    private String claimant;
    private Instant claimedAt;
}
