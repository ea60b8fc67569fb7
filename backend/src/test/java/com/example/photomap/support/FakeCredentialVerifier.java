package com.example.photomap.support;

import com.example.photomap.model.Passkey;
import com.example.photomap.webauthn.CredentialVerificationException;
import com.example.photomap.webauthn.CredentialVerifier;
import com.example.photomap.webauthn.IssuedChallenge;
import com.example.photomap.webauthn.PasskeyUser;
import com.example.photomap.webauthn.VerifiedAssertion;
import com.example.photomap.webauthn.VerifiedCredential;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Stands in for an authenticator and the ceremony checks. A response verifies when it echoes
 * the challenge of the request it answers; see {@link #registrationResponse} and
 * {@link #assertionResponse}.
 */
public class FakeCredentialVerifier implements CredentialVerifier {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final AtomicInteger counter = new AtomicInteger();
    private volatile PasskeyUser lastRegistrationUser;
    private volatile List<Passkey> lastExcluded = List.of();

    @Override
    public IssuedChallenge startRegistration(PasskeyUser user, List<Passkey> existing) {
        lastRegistrationUser = user;
        lastExcluded = existing;
        String challenge = "reg-challenge-" + counter.incrementAndGet();
        ObjectNode publicKey = MAPPER.createObjectNode();
        publicKey.put("challenge", challenge);
        publicKey.putObject("user").put("id", user.userHandle()).put("name", user.email());
        return new IssuedChallenge(challenge, publicKey);
    }

    @Override
    public VerifiedCredential finishRegistration(String requestJson, JsonNode credential)
            throws CredentialVerificationException {
        requireEcho(requestJson, credential);
        return new VerifiedCredential(credential.path("id").asText(), "cose-" + credential.path("id").asText(), 0,
                List.of("internal"));
    }

    @Override
    public IssuedChallenge startAssertion(PasskeyUser user, List<Passkey> passkeys) {
        String challenge = "auth-challenge-" + counter.incrementAndGet();
        ObjectNode publicKey = MAPPER.createObjectNode();
        publicKey.put("challenge", challenge);
        ArrayNode allowed = publicKey.putArray("allowCredentials");
        passkeys.forEach(passkey -> allowed.addObject().put("type", "public-key").put("id", passkey.getCredentialId()));
        return new IssuedChallenge(challenge, publicKey);
    }

    @Override
    public VerifiedAssertion finishAssertion(String requestJson, JsonNode credential, PasskeyUser user, Passkey passkey)
            throws CredentialVerificationException {
        requireEcho(requestJson, credential);
        return new VerifiedAssertion(passkey.getCredentialId(), passkey.getSignCount() + 1);
    }

    public PasskeyUser lastRegistrationUser() {
        return lastRegistrationUser;
    }

    public List<Passkey> lastExcluded() {
        return lastExcluded;
    }

    public static JsonNode registrationResponse(JsonNode options, String credentialId) {
        return response(options, credentialId);
    }

    public static JsonNode assertionResponse(JsonNode options, String credentialId) {
        return response(options, credentialId);
    }

    private static JsonNode response(JsonNode options, String credentialId) {
        ObjectNode response = MAPPER.createObjectNode();
        response.put("id", credentialId);
        response.put("rawId", credentialId);
        response.put("type", "public-key");
        response.put("challenge", options.path("challenge").asText());
        return response;
    }

    private static void requireEcho(String requestJson, JsonNode credential) throws CredentialVerificationException {
        if (credential == null || !requestJson.equals(credential.path("challenge").asText())) {
            throw new CredentialVerificationException("challenge mismatch");
        }
    }
}
