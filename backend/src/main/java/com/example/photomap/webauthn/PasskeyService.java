package com.example.photomap.webauthn;

import com.example.photomap.auditlog.SecurityAuditService;
import com.example.photomap.exceptions.PhotoMapException;
import com.example.photomap.identity.IdentityStore;
import com.example.photomap.model.Passkey;
import com.example.photomap.model.UserProfile;
import com.example.photomap.repo.PasskeyRepository;
import com.example.photomap.repo.UserProfileRepository;
import com.example.photomap.security.AuthenticatedUser;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/** Passkey management for a signed-in identity. */
@Service
public class PasskeyService {

    private static final Logger log = LoggerFactory.getLogger(PasskeyService.class);

    private final UserProfileRepository users;
    private final PasskeyRepository passkeys;
    private final ChallengeStore challengeStore;
    private final CredentialVerifier credentialVerifier;
    private final IdentityStore identityStore;
    private final SecurityAuditService auditService;

    public PasskeyService(UserProfileRepository users,
                          PasskeyRepository passkeys,
                          ChallengeStore challengeStore,
                          CredentialVerifier credentialVerifier,
                          IdentityStore identityStore,
                          SecurityAuditService auditService) {
        this.users = users;
        this.passkeys = passkeys;
        this.challengeStore = challengeStore;
        this.credentialVerifier = credentialVerifier;
        this.identityStore = identityStore;
        this.auditService = auditService;
    }

    public JsonNode startAddPasskey(AuthenticatedUser principal) {
        UserProfile user = users.findById(principal.id()).orElseThrow(PhotoMapException.notFound("User not found"));
        List<Passkey> existing = passkeys.findByUserId(user.getId());
        IssuedChallenge issued = credentialVerifier.startRegistration(
                new PasskeyUser(user.getWebauthnUserHandle(), user.getEmail(), user.getDisplayName()), existing);
        challengeStore.put(user.getEmail(), new PendingChallenge(ChallengePurpose.ADD_PASSKEY, issued.requestJson(),
                user.getId(), user.getWebauthnUserHandle(), user.getDisplayName(), null));
        return issued.publicKey();
    }

    public Passkey finishAddPasskey(AuthenticatedUser principal, JsonNode credential) {
        UserProfile user = users.findById(principal.id()).orElseThrow(PhotoMapException.notFound("User not found"));
        PendingChallenge pending = challengeStore.take(user.getEmail())
                .filter(challenge -> challenge.isFor(ChallengePurpose.ADD_PASSKEY))
                .filter(challenge -> user.getId().equals(challenge.userId()))
                .orElse(null);
        challengeStore.clear(user.getEmail());
        if (pending == null) {
            throw new PhotoMapException(PhotoMapException.Errors.CHALLENGE_EXPIRED,
                    "Challenge expired or not found. Please start again.");
        }

        VerifiedCredential verified;
        try {
            verified = credentialVerifier.finishRegistration(pending.requestJson(), credential);
        } catch (CredentialVerificationException ex) {
            log.info("Additional passkey rejected for {}: {}", user.getId(), ex.getMessage());
            throw new PhotoMapException(PhotoMapException.Errors.REGISTRATION_FAILED, "Verification failed");
        }

        Passkey passkey = identityStore.attachPasskey(user.getId(), verified);
        auditService.recordPasskeyRegistered(user.getId(), passkey.getCredentialId());
        return passkey;
    }

    public List<Passkey> list(AuthenticatedUser principal) {
        return passkeys.findByUserId(principal.id());
    }

    public void delete(AuthenticatedUser principal, String credentialId) {
        identityStore.deletePasskey(principal.id(), credentialId);
        auditService.recordPasskeyDeleted(principal.id(), credentialId);
    }
}
