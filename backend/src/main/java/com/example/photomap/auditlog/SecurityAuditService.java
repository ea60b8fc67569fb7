package com.example.photomap.auditlog;

import com.example.photomap.model.AuditLog;
import com.example.photomap.repo.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Persists security relevant events to {@code audit_logs}. A failing audit write is logged and
 * never breaks the operation being audited.
 */
@Service
public class SecurityAuditService {

    private static final Logger log = LoggerFactory.getLogger(SecurityAuditService.class);

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public SecurityAuditService(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    public void recordIdentityCreated(String userId, boolean admin) {
        save(userId, AuditEvent.IDENTITY_CREATED, userId, admin ? "First identity, granted admin" : "Identity created");
    }

    public void recordPasskeyRegistered(String userId, String credentialId) {
        save(userId, AuditEvent.PASSKEY_REGISTERED, userId,
                "New passkey registered (credential=" + abbreviate(credentialId) + ")");
    }

    public void recordPasskeyDeleted(String userId, String credentialId) {
        save(userId, AuditEvent.PASSKEY_DELETED, userId,
                "Passkey removed (credential=" + abbreviate(credentialId) + ")");
    }

    public void recordPasskeyAuthenticationSuccess(String userId) {
        save(userId, AuditEvent.LOGIN_SUCCEEDED, userId, "Signed in with passkey");
    }

    public void recordPasskeyAuthenticationFailure(String identifier) {
        save(null, AuditEvent.LOGIN_FAILED, null,
                "Passkey assertion rejected for identifier=" + sanitize(identifier));
    }

    public void recordRecoveryRequested(String identifier) {
        save(null, AuditEvent.RECOVERY_REQUESTED, null, "Recovery requested for identifier=" + sanitize(identifier));
    }

    public void recordRecoveryFailure(String userId, boolean locked) {
        save(userId, AuditEvent.RECOVERY_FAILED, userId,
                locked ? "Recovery code locked after too many attempts" : "Wrong recovery code");
    }

    public void recordRecoveryCompleted(String userId, long passkeysRemoved) {
        save(userId, AuditEvent.RECOVERY_COMPLETED, userId, "Recovery completed, removed " + passkeysRemoved + " passkey(s)");
    }

    public void recordInviteCreated(String adminId, String inviteId, int tripCount) {
        save(adminId, AuditEvent.INVITE_CREATED, inviteId, "Invite created for " + tripCount + " trip(s)");
    }

    public void recordInviteRevoked(String adminId, String inviteId) {
        save(adminId, AuditEvent.INVITE_REVOKED, inviteId, "Invite revoked");
    }

    public void recordInviteConsumed(String userId, String inviteId) {
        save(userId, AuditEvent.INVITE_CONSUMED, inviteId, "Invite consumed at registration");
    }

    public void recordAccessGranted(String adminId, String accessId, String userId, String tripId) {
        save(adminId, AuditEvent.ACCESS_GRANTED, accessId, "user=" + userId + " trip=" + tripId);
    }

    public void recordAccessUpdated(String adminId, String accessId) {
        save(adminId, AuditEvent.ACCESS_UPDATED, accessId, "Role changed");
    }

    public void recordAccessRevoked(String adminId, String accessId) {
        save(adminId, AuditEvent.ACCESS_REVOKED, accessId, "Access revoked");
    }

    private void save(String actorId, AuditEvent event, String subjectId, String detail) {
        AuditLog entry = AuditLog.builder()
                .actorId(actorId)
                .event(event)
                .category(event.category())
                .subjectId(subjectId)
                .detail(detail)
                .occurredAt(clock.instant())
                .build();
        try {
            auditLogRepository.save(entry);
        } catch (DataAccessException ex) {
            log.warn("Could not persist audit event {}: {}", event, ex.getMessage());
        }
    }

    private String sanitize(String identifier) {
        if (identifier == null) {
            return "unknown";
        }
        return identifier.replaceAll("[^a-zA-Z0-9@._-]", "?");
    }

    private String abbreviate(String credentialId) {
        if (credentialId == null) {
            return "unknown";
        }
        String trimmed = credentialId.trim();
        if (trimmed.length() <= 8) {
            return trimmed;
        }
        return trimmed.substring(0, 4) + "..." + trimmed.substring(trimmed.length() - 4);
    }
}
