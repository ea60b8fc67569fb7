package com.example.photomap.webauthn;

import com.example.photomap.auditlog.SecurityAuditService;
import com.example.photomap.exceptions.PhotoMapException;
import com.example.photomap.identity.Emails;
import com.example.photomap.model.Passkey;
import com.example.photomap.model.UserProfile;
import com.example.photomap.repo.PasskeyRepository;
import com.example.photomap.repo.UserProfileRepository;
import com.example.photomap.security.JwtService;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Passkey login. Every failure, from an unknown email to a bad signature, surfaces as the same
 * {@code AUTHENTICATION_FAILED} answer.
 */
@Service
public class LoginService {

    private static final Logger log = LoggerFactory.getLogger(LoginService.class);

    static final String AUTH_ERROR = "Authentication failed";

    private final UserProfileRepository users;
    private final PasskeyRepository passkeys;
    private final ChallengeStore challengeStore;
    private final CredentialVerifier credentialVerifier;
    private final JwtService jwtService;
    private final SecurityAuditService auditService;
    private final Clock clock;

    public LoginService(UserProfileRepository users,
                        PasskeyRepository passkeys,
                        ChallengeStore challengeStore,
                        CredentialVerifier credentialVerifier,
                        JwtService jwtService,
                        SecurityAuditService auditService,
                        Clock clock) {
        this.users = users;
        this.passkeys = passkeys;
        this.challengeStore = challengeStore;
        this.credentialVerifier = credentialVerifier;
        this.jwtService = jwtService;
        this.auditService = auditService;
        this.clock = clock;
    }

    public JsonNode startLogin(String rawEmail) {
        String email = Emails.normalize(rawEmail);
        UserProfile user = users.findByEmail(email).orElseThrow(this::failure);
        List<Passkey> registered = passkeys.findByUserId(user.getId());
        if (registered.isEmpty()) {
            throw failure();
        }

        IssuedChallenge issued = credentialVerifier.startAssertion(toPasskeyUser(user), registered);
        challengeStore.put(email, PendingChallenge.login(issued.requestJson(), user.getId()));
        return issued.publicKey();
    }

    public AuthenticatedSession finishLogin(String rawEmail, JsonNode credential) {
        String email = Emails.normalize(rawEmail);
        Optional<PendingChallenge> pending = challengeStore.take(email)
                .filter(challenge -> challenge.isFor(ChallengePurpose.LOGIN));
        challengeStore.clear(email);
        if (pending.isEmpty()) {
            auditService.recordPasskeyAuthenticationFailure(email);
            throw failure();
        }

        String credentialId = credential == null ? "" : credential.path("id").asText("");
        Optional<UserProfile> user = users.findById(pending.get().userId())
                .filter(profile -> profile.getEmail().equals(email));
        Optional<Passkey> passkey = user.flatMap(profile -> passkeys.findByCredentialId(credentialId)
                .filter(candidate -> candidate.getUserId().equals(profile.getId())));
        if (user.isEmpty() || passkey.isEmpty()) {
            auditService.recordPasskeyAuthenticationFailure(email);
            throw failure();
        }

        VerifiedAssertion assertion;
        try {
            assertion = credentialVerifier.finishAssertion(pending.get().requestJson(), credential,
                    toPasskeyUser(user.get()), passkey.get());
        } catch (CredentialVerificationException ex) {
            log.info("Passkey assertion rejected for {}: {}", email, ex.getMessage());
            auditService.recordPasskeyAuthenticationFailure(email);
            throw failure();
        }

        passkeys.recordUse(assertion.credentialId(), assertion.signCount(), clock.instant());
        auditService.recordPasskeyAuthenticationSuccess(user.get().getId());
        return new AuthenticatedSession(user.get(), jwtService.generate(user.get()));
    }

    private PasskeyUser toPasskeyUser(UserProfile user) {
        return new PasskeyUser(user.getWebauthnUserHandle(), user.getEmail(), user.getDisplayName());
    }

    private PhotoMapException failure() {
        return new PhotoMapException(PhotoMapException.Errors.AUTHENTICATION_FAILED, AUTH_ERROR);
    }
}
