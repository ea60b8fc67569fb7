package com.example.photomap.identity;

import com.example.photomap.exceptions.PhotoMapException;
import com.example.photomap.invite.InviteService;
import com.example.photomap.model.Invite;
import com.example.photomap.model.Passkey;
import com.example.photomap.model.TripAccess;
import com.example.photomap.model.UserProfile;
import com.example.photomap.repo.AdminClaimRepository;
import com.example.photomap.repo.PasskeyRepository;
import com.example.photomap.repo.RecoveryTokenRepository;
import com.example.photomap.repo.TripAccessRepository;
import com.example.photomap.repo.UserProfileRepository;
import com.example.photomap.webauthn.VerifiedCredential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * The multi-document writes on identities and their passkeys. Each public method is one
 * transaction: either everything it touches is written or nothing is.
 */
@Service
public class IdentityStore {

    private static final Logger log = LoggerFactory.getLogger(IdentityStore.class);

    private final UserProfileRepository users;
    private final PasskeyRepository passkeys;
    private final RecoveryTokenRepository recoveryTokens;
    private final TripAccessRepository tripAccess;
    private final InviteService inviteService;
    private final AdminClaimRepository adminClaims;
    private final Clock clock;

    public IdentityStore(UserProfileRepository users,
                         PasskeyRepository passkeys,
                         RecoveryTokenRepository recoveryTokens,
                         TripAccessRepository tripAccess,
                         InviteService inviteService,
                         AdminClaimRepository adminClaims,
                         Clock clock) {
        this.users = users;
        this.passkeys = passkeys;
        this.recoveryTokens = recoveryTokens;
        this.tripAccess = tripAccess;
        this.inviteService = inviteService;
        this.adminClaims = adminClaims;
        this.clock = clock;
    }

    /**
     * Inserts the identity and its first passkey. With an invite code the invite is consumed
     * and one grant per bound trip is written; an invite that stopped being usable since the
     * options call aborts the whole registration.
     *
     * <p>The first-admin claim is taken last, after every step that can reject the
     * registration, and rolls back with it otherwise.
     */
    @Transactional
    public CreatedIdentity createIdentity(NewIdentity identity, VerifiedCredential credential, String inviteCode) {
        Instant now = clock.instant();
        UserProfile profile = UserProfile.builder()
                .id(UUID.randomUUID().toString())
                .email(identity.email())
                .webauthnUserHandle(identity.userHandle())
                .displayName(identity.displayName())
                .admin(false)
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            profile = users.insert(profile);
        } catch (DuplicateKeyException ex) {
            throw new PhotoMapException(PhotoMapException.Errors.EMAIL_ALREADY_REGISTERED,
                    "Email already registered. Please use login.", ex);
        }

        Passkey passkey = insertPasskey(profile.getId(), credential, now);

        Invite invite = null;
        if (inviteCode != null) {
            invite = inviteService.consume(inviteCode, profile.getEmail(), profile.getId());
        }

        if (adminClaims.tryClaim(profile.getId(), now)) {
            users.markAdmin(profile.getId(), now);
            profile.setAdmin(true);
        }

        // admins see every trip; a grant row for one would be meaningless
        if (invite != null && !profile.isAdmin()) {
            for (String tripId : invite.getTripIds()) {
                tripAccess.insert(TripAccess.builder()
                        .id(UUID.randomUUID().toString())
                        .userId(profile.getId())
                        .tripId(tripId)
                        .role(invite.getRole())
                        .grantedAt(now)
                        .grantedByUserId(invite.getCreatedByUserId())
                        .build());
            }
        }
        return new CreatedIdentity(profile, passkey, invite);
    }

    @Transactional
    public Passkey attachPasskey(String userId, VerifiedCredential credential) {
        Instant now = clock.instant();
        if (!users.touch(userId, now)) {
            throw PhotoMapException.notFound("User not found").get();
        }
        return insertPasskey(userId, credential, now);
    }

    /**
     * Re-registration after recovery. Fails when the identity gained a passkey after the options
     * call, so two racing re-registrations cannot both attach one.
     */
    @Transactional
    public Passkey attachFirstPasskey(String userId, VerifiedCredential credential) {
        Instant now = clock.instant();
        if (!users.touch(userId, now)) {
            throw PhotoMapException.notFound("User not found").get();
        }
        if (passkeys.countByUserId(userId) > 0) {
            throw new PhotoMapException(PhotoMapException.Errors.EMAIL_ALREADY_REGISTERED,
                    "Email already registered. Please use login.");
        }
        return insertPasskey(userId, credential, now);
    }

    /**
     * Claims the recovery token and wipes every passkey of its identity. Returns how many
     * passkeys were removed. A token that ran out of attempts is refused even when its lock
     * marker is still missing.
     */
    @Transactional
    public long completeRecovery(String tokenId, String userId, int maxAttempts) {
        Instant now = clock.instant();
        if (!recoveryTokens.claim(tokenId, maxAttempts, now)) {
            throw new PhotoMapException(PhotoMapException.Errors.RECOVERY_CODE_INVALID, "Invalid or expired code");
        }
        users.touch(userId, now);
        long removed = passkeys.deleteByUserId(userId);
        log.info("Recovery claimed for user {}, removed {} passkey(s)", userId, removed);
        return removed;
    }

    @Transactional
    public void deletePasskey(String userId, String credentialId) {
        // serialises concurrent deletes of the same identity's passkeys
        users.touch(userId, clock.instant());
        if (passkeys.countByUserId(userId) <= 1) {
            throw new PhotoMapException(PhotoMapException.Errors.LAST_PASSKEY, "Cannot delete your only passkey");
        }
        if (!passkeys.delete(userId, credentialId)) {
            throw PhotoMapException.notFound("Passkey not found").get();
        }
    }

    private Passkey insertPasskey(String userId, VerifiedCredential credential, Instant now) {
        Passkey passkey = Passkey.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .credentialId(credential.credentialId())
                .publicKeyCose(credential.publicKeyCose())
                .signCount(credential.signCount())
                .transports(credential.transports())
                .createdAt(now)
                .build();
        try {
            return passkeys.insert(passkey);
        } catch (DuplicateKeyException ex) {
            throw new PhotoMapException(PhotoMapException.Errors.PASSKEY_ALREADY_REGISTERED,
                    "This passkey is already registered", ex);
        }
    }
}
