package com.example.photomap.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/** Trip metadata owned by the photo side of the service; only read here. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document("trips")
public class Trip {
    @Id
    private String id;

    private String title;
    private String slug;
}
