package com.example.photomap.webauthn;

import com.example.photomap.model.Passkey;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * WebAuthn ceremonies without storage. Callers keep {@link IssuedChallenge#requestJson()} and
 * hand it back together with the browser's response.
 */
public interface CredentialVerifier {

    /** Creation options for {@code user}; {@code existing} credentials are excluded. */
    IssuedChallenge startRegistration(PasskeyUser user, List<Passkey> existing);

    VerifiedCredential finishRegistration(String requestJson, JsonNode credential)
            throws CredentialVerificationException;

    /** Request options allowing exactly {@code passkeys}. */
    IssuedChallenge startAssertion(PasskeyUser user, List<Passkey> passkeys);

    /** Verifies signature, origin, relying party and counter against the stored {@code passkey}. */
    VerifiedAssertion finishAssertion(String requestJson, JsonNode credential, PasskeyUser user, Passkey passkey)
            throws CredentialVerificationException;
}
