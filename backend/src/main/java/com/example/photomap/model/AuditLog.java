package com.example.photomap.model;

import com.example.photomap.auditlog.AuditEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One security event. {@code actorId} is the identity that caused it (absent for anonymous
 * attempts), {@code subjectId} the invite, grant or identity it concerns.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document("audit_logs")
public class AuditLog {
    @Id
    private String id;

    @Indexed
    private String actorId;

    private AuditEvent event;
    private AuditEvent.Category category;
    private String subjectId;
    private String detail;

    @Indexed
    private Instant occurredAt;
}
