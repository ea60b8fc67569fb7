package com.example.photomap.webauthn;

import com.example.photomap.auditlog.SecurityAuditService;
import com.example.photomap.config.InviteProps;
import com.example.photomap.exceptions.PhotoMapException;
import com.example.photomap.identity.CreatedIdentity;
import com.example.photomap.identity.Emails;
import com.example.photomap.identity.IdentityStore;
import com.example.photomap.identity.NewIdentity;
import com.example.photomap.invite.InviteService;
import com.example.photomap.model.Passkey;
import com.example.photomap.model.UserProfile;
import com.example.photomap.repo.PasskeyRepository;
import com.example.photomap.repo.UserProfileRepository;
import com.example.photomap.security.JwtService;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Registration of a new identity, and re-registration of an identity that lost all of its
 * passkeys through recovery.
 *
 * <p>An email that already has a passkey cannot register again. An email whose identity has no
 * passkey left reuses that identity and its WebAuthn user handle, so authenticators replace the
 * old credential instead of creating a second account entry.
 */
@Service
public class RegistrationService {

    private static final Logger log = LoggerFactory.getLogger(RegistrationService.class);

    static final int USER_HANDLE_BYTES = 32;
    static final int MAX_DISPLAY_NAME = 100;

    private final UserProfileRepository users;
    private final PasskeyRepository passkeys;
    private final ChallengeStore challengeStore;
    private final CredentialVerifier credentialVerifier;
    private final IdentityStore identityStore;
    private final InviteService inviteService;
    private final InviteProps inviteProps;
    private final JwtService jwtService;
    private final SecurityAuditService auditService;
    private final SecureRandom secureRandom = new SecureRandom();

    public RegistrationService(UserProfileRepository users,
                               PasskeyRepository passkeys,
                               ChallengeStore challengeStore,
                               CredentialVerifier credentialVerifier,
                               IdentityStore identityStore,
                               InviteService inviteService,
                               InviteProps inviteProps,
                               JwtService jwtService,
                               SecurityAuditService auditService) {
        this.users = users;
        this.passkeys = passkeys;
        this.challengeStore = challengeStore;
        this.credentialVerifier = credentialVerifier;
        this.identityStore = identityStore;
        this.inviteService = inviteService;
        this.inviteProps = inviteProps;
        this.jwtService = jwtService;
        this.auditService = auditService;
    }

    public JsonNode startRegistration(String rawEmail, String rawDisplayName, String rawInviteCode) {
        String email = Emails.normalize(rawEmail);
        String displayName = sanitizeDisplayName(rawDisplayName);
        String inviteCode = rawInviteCode == null || rawInviteCode.isBlank() ? null : rawInviteCode.trim();

        Optional<UserProfile> existing = users.findByEmail(email);
        PendingChallenge pending;
        IssuedChallenge issued;
        if (existing.isPresent()) {
            UserProfile user = existing.get();
            if (passkeys.countByUserId(user.getId()) > 0) {
                throw new PhotoMapException(PhotoMapException.Errors.EMAIL_ALREADY_REGISTERED,
                        "Email already registered. Please use login.");
            }
            String name = displayName != null ? displayName : user.getDisplayName();
            issued = credentialVerifier.startRegistration(
                    new PasskeyUser(user.getWebauthnUserHandle(), email, name), List.of());
            pending = new PendingChallenge(ChallengePurpose.REGISTRATION, issued.requestJson(), user.getId(),
                    user.getWebauthnUserHandle(), name, null);
            log.info("Passkey re-registration started for recovered user {}", user.getId());
        } else {
            if (inviteCode != null) {
                inviteService.requireUsableFor(inviteCode, email);
            } else if (isInviteRequired()) {
                throw new PhotoMapException(PhotoMapException.Errors.REGISTRATION_CLOSED,
                        "Registration requires a valid invite");
            }
            String userHandle = newUserHandle();
            issued = credentialVerifier.startRegistration(new PasskeyUser(userHandle, email, displayName), List.of());
            pending = new PendingChallenge(ChallengePurpose.REGISTRATION, issued.requestJson(), null,
                    userHandle, displayName, inviteCode);
        }

        challengeStore.put(email, pending);
        return issued.publicKey();
    }

    public AuthenticatedSession finishRegistration(String rawEmail, JsonNode credential) {
        String email = Emails.normalize(rawEmail);
        PendingChallenge pending = challengeStore.take(email)
                .filter(challenge -> challenge.isFor(ChallengePurpose.REGISTRATION))
                .orElse(null);
        challengeStore.clear(email);
        if (pending == null) {
            throw new PhotoMapException(PhotoMapException.Errors.CHALLENGE_EXPIRED,
                    "Registration challenge expired or not found. Please start again.");
        }

        VerifiedCredential verified;
        try {
            verified = credentialVerifier.finishRegistration(pending.requestJson(), credential);
        } catch (CredentialVerificationException ex) {
            log.info("Passkey registration rejected for {}: {}", email, ex.getMessage());
            throw new PhotoMapException(PhotoMapException.Errors.REGISTRATION_FAILED, "Registration verification failed");
        }

        UserProfile user;
        if (pending.userId() != null) {
            Passkey passkey = identityStore.attachFirstPasskey(pending.userId(), verified);
            user = users.findById(pending.userId()).orElseThrow(PhotoMapException.notFound("User not found"));
            auditService.recordPasskeyRegistered(user.getId(), passkey.getCredentialId());
        } else {
            user = createIdentity(email, pending, verified);
        }

        return new AuthenticatedSession(user, jwtService.generate(user));
    }

    /** Whether a brand new identity needs an invite right now. */
    public boolean isInviteRequired() {
        return inviteProps.isRequiredAfterFirstUser() && users.count() > 0;
    }

    private UserProfile createIdentity(String email, PendingChallenge pending, VerifiedCredential verified) {
        CreatedIdentity created = identityStore.createIdentity(
                new NewIdentity(email, pending.userHandle(), pending.displayName()),
                verified, pending.inviteCode());

        UserProfile user = created.user();
        if (user.isAdmin()) {
            log.info("First identity {} registered as admin", user.getId());
        } else {
            log.info("Identity {} registered{}", user.getId(), created.invite() != null ? " with invite" : "");
        }
        auditService.recordIdentityCreated(user.getId(), user.isAdmin());
        auditService.recordPasskeyRegistered(user.getId(), created.passkey().getCredentialId());
        return user;
    }

    private String newUserHandle() {
        byte[] bytes = new byte[USER_HANDLE_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    static String sanitizeDisplayName(String displayName) {
        if (displayName == null) {
            return null;
        }
        String trimmed = displayName.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > MAX_DISPLAY_NAME ? trimmed.substring(0, MAX_DISPLAY_NAME) : trimmed;
    }
}
