package com.example.photomap.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document("trip_access")
@CompoundIndex(name = "user_trip_unique", def = "{'userId': 1, 'tripId': 1}", unique = true)
public class TripAccess {
    @Id
    private String id;

    private String userId;
    private String tripId;
    private TripRole role;
    private Instant grantedAt;
    private String grantedByUserId;
}
