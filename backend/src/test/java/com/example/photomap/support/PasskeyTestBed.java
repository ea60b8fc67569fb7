package com.example.photomap.support;

import com.example.photomap.access.TripAccessGate;
import com.example.photomap.access.TripAccessService;
import com.example.photomap.auditlog.SecurityAuditService;
import com.example.photomap.config.InviteProps;
import com.example.photomap.identity.IdentityStore;
import com.example.photomap.invite.InviteCodeGenerator;
import com.example.photomap.invite.InviteService;
import com.example.photomap.security.JwtService;
import com.example.photomap.webauthn.AuthenticatedSession;
import com.example.photomap.webauthn.InMemoryChallengeStore;
import com.example.photomap.webauthn.LoginService;
import com.example.photomap.webauthn.PasskeyService;
import com.example.photomap.webauthn.RegistrationService;
import com.example.photomap.webauthn.WebAuthnProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

import static org.mockito.Mockito.mock;

/**
 * The passkey, invite and trip access services wired over in-memory repositories, a fake
 * authenticator and a controllable clock. No transactions: a failing multi-document write
 * leaves partial state behind, so tests only look at state after successful calls.
 */
public class PasskeyTestBed {

    public static final String JWT_SECRET = "test-secret-with-at-least-thirty-two-bytes!";

    public final MutableClock clock = new MutableClock();
    public final InMemoryUserProfileRepository users;
    public final InMemoryPasskeyRepository passkeys = new InMemoryPasskeyRepository();
    public final InMemoryRecoveryTokenRepository recoveryTokens = new InMemoryRecoveryTokenRepository();
    public final InMemoryInviteRepository invites = new InMemoryInviteRepository();
    public final InMemoryTripAccessRepository tripAccess = new InMemoryTripAccessRepository();
    public final InMemoryTripRepository trips = new InMemoryTripRepository();
    public final InMemoryAdminClaimRepository adminClaims = new InMemoryAdminClaimRepository();
    public final FakeCredentialVerifier verifier = new FakeCredentialVerifier();
    public final SecurityAuditService audit = mock(SecurityAuditService.class);
    public final InviteProps inviteProps = new InviteProps();
    public final InMemoryChallengeStore challengeStore;
    public final JwtService jwtService;
    public final InviteService inviteService;
    public final IdentityStore identityStore;
    public final RegistrationService registrationService;
    public final LoginService loginService;
    public final PasskeyService passkeyService;
    public final TripAccessService tripAccessService;
    public final TripAccessGate tripAccessGate;

    public PasskeyTestBed() {
        this(new InMemoryUserProfileRepository());
    }

    /** For tests that need to interleave work with identity writes. */
    public PasskeyTestBed(InMemoryUserProfileRepository users) {
        this.users = users;
        WebAuthnProperties webAuthnProperties = new WebAuthnProperties();
        webAuthnProperties.setRelyingPartyId("localhost");
        webAuthnProperties.setRelyingPartyName("Photo Map");
        webAuthnProperties.setOrigins(List.of("http://localhost:5173"));
        challengeStore = new InMemoryChallengeStore(webAuthnProperties, clock);
        jwtService = new JwtService(JWT_SECRET, 60, clock);
        inviteService = new InviteService(invites, trips, new InviteCodeGenerator(), inviteProps, audit, clock);
        identityStore = new IdentityStore(users, passkeys, recoveryTokens, tripAccess, inviteService, adminClaims, clock);
        registrationService = new RegistrationService(users, passkeys, challengeStore, verifier,
                identityStore, inviteService, inviteProps, jwtService, audit);
        loginService = new LoginService(users, passkeys, challengeStore, verifier, jwtService, audit, clock);
        passkeyService = new PasskeyService(users, passkeys, challengeStore, verifier, identityStore, audit);
        tripAccessService = new TripAccessService(tripAccess, users, trips, audit, clock);
        tripAccessGate = new TripAccessGate(tripAccess);
    }

    public AuthenticatedSession register(String email, String credentialId) {
        return register(email, credentialId, null);
    }

    public AuthenticatedSession register(String email, String credentialId, String inviteCode) {
        JsonNode options = registrationService.startRegistration(email, null, inviteCode);
        return registrationService.finishRegistration(email,
                FakeCredentialVerifier.registrationResponse(options, credentialId));
    }

    public AuthenticatedSession login(String email, String credentialId) {
        JsonNode options = loginService.startLogin(email);
        return loginService.finishLogin(email, FakeCredentialVerifier.assertionResponse(options, credentialId));
    }
}
