package com.example.photomap.auth;

import com.example.photomap.auditlog.SecurityAuditService;
import com.example.photomap.config.RecoveryProps;
import com.example.photomap.exceptions.PhotoMapException;
import com.example.photomap.identity.Emails;
import com.example.photomap.identity.IdentityStore;
import com.example.photomap.model.RecoveryToken;
import com.example.photomap.model.UserProfile;
import com.example.photomap.notification.NotificationDispatcher;
import com.example.photomap.repo.RecoveryTokenRepository;
import com.example.photomap.repo.UserProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;
import java.util.UUID;

/**
 * Operator-assisted account recovery. A six digit code goes to the operator channel; entering
 * it removes every passkey of the identity so the owner can register a new one under the same
 * account.
 *
 * <p>Requesting a code answers the same way, after roughly the same time, whether or not the
 * email belongs to anybody.
 */
@Service
public class RecoveryService {

    private static final Logger log = LoggerFactory.getLogger(RecoveryService.class);

    static final String INVALID_CODE = "Invalid or expired code";
    static final String LOCKED = "Too many failed attempts. Please request a new recovery code.";

    private final UserProfileRepository users;
    private final RecoveryTokenRepository tokens;
    private final IdentityStore identityStore;
    private final NotificationDispatcher notifications;
    private final SecurityAuditService auditService;
    private final RecoveryProps props;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public RecoveryService(UserProfileRepository users,
                           RecoveryTokenRepository tokens,
                           IdentityStore identityStore,
                           NotificationDispatcher notifications,
                           SecurityAuditService auditService,
                           RecoveryProps props,
                           Clock clock) {
        this.users = users;
        this.tokens = tokens;
        this.identityStore = identityStore;
        this.notifications = notifications;
        this.auditService = auditService;
        this.props = props;
        this.clock = clock;
    }

    public void requestRecovery(String rawEmail) {
        String email = Emails.normalize(rawEmail);

        // generated for unknown emails too, keeps both paths doing the same work
        String code = generateCode();
        Instant now = clock.instant();
        Instant expiresAt = now.plus(props.getCodeTtl());

        Optional<UserProfile> user = users.findByEmail(email);
        if (user.isPresent()) {
            String userId = user.get().getId();
            tokens.invalidateActive(userId);
            tokens.insert(RecoveryToken.builder()
                    .id(UUID.randomUUID().toString())
                    .userId(userId)
                    .codeHash(hash(code))
                    .expiresAt(expiresAt)
                    .attempts(0)
                    .createdAt(now)
                    .build());
            notifications.dispatch("Recovery Code",
                    "Account: " + email + "\nCode: " + code + "\n\nExpires at: " + expiresAt
                            + "\n(" + props.getCodeTtl().toMinutes() + " minutes from now)");
            log.info("Recovery code issued for user {}", userId);
        }
        auditService.recordRecoveryRequested(email);
        pause();
    }

    /**
     * Checks the code against the newest live token of the email. Returns normally when the
     * passkeys of the identity were cleared.
     */
    public void verifyRecovery(String rawEmail, String code) {
        String email = Emails.normalize(rawEmail);
        UserProfile user = users.findByEmail(email).orElseThrow(this::invalidCode);
        RecoveryToken token = tokens.findLatestUnused(user.getId(), clock.instant()).orElseThrow(this::invalidCode);
        if (token.isExhausted(props.getMaxAttempts())) {
            throw new PhotoMapException(PhotoMapException.Errors.RECOVERY_LOCKED, LOCKED);
        }

        if (!matches(code, token.getCodeHash())) {
            RecoveryToken updated = tokens.recordFailedAttempt(token.getId(), props.getMaxAttempts(), clock.instant())
                    .orElseThrow(this::invalidCode);
            boolean locked = updated.isLocked();
            auditService.recordRecoveryFailure(user.getId(), locked);
            if (locked) {
                log.warn("Recovery token of user {} locked after {} failed attempts", user.getId(), updated.getAttempts());
                throw new PhotoMapException(PhotoMapException.Errors.RECOVERY_LOCKED, LOCKED);
            }
            int remaining = props.getMaxAttempts() - updated.getAttempts();
            throw new PhotoMapException(PhotoMapException.Errors.RECOVERY_CODE_INVALID,
                    "Invalid code. " + remaining + " attempts remaining.");
        }

        long removed = identityStore.completeRecovery(token.getId(), user.getId(), props.getMaxAttempts());
        auditService.recordRecoveryCompleted(user.getId(), removed);
        notifications.dispatch("Recovery completed", "Recovery successful for " + email + ". Passkeys cleared.");
    }

    private PhotoMapException invalidCode() {
        return new PhotoMapException(PhotoMapException.Errors.RECOVERY_CODE_INVALID, INVALID_CODE);
    }

    String generateCode() {
        return Integer.toString(100_000 + secureRandom.nextInt(900_000));
    }

    static String hash(String code) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(digest(code));
    }

    private static boolean matches(String code, String expectedHash) {
        if (code == null || expectedHash == null) {
            return false;
        }
        byte[] actual = hash(code.trim()).getBytes(StandardCharsets.US_ASCII);
        byte[] expected = expectedHash.getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(actual, expected);
    }

    private static byte[] digest(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }

    private void pause() {
        long min = Math.max(0, props.getMinResponseDelay().toMillis());
        long max = Math.max(min, props.getMaxResponseDelay().toMillis());
        long delay = min == max ? min : min + secureRandom.nextInt((int) (max - min + 1));
        if (delay == 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
