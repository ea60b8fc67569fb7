package com.example.photomap.webauthn;

import com.example.photomap.model.Passkey;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yubico.webauthn.AssertionRequest;
import com.yubico.webauthn.AssertionResult;
import com.yubico.webauthn.CredentialRepository;
import com.yubico.webauthn.FinishAssertionOptions;
import com.yubico.webauthn.FinishRegistrationOptions;
import com.yubico.webauthn.RegistrationResult;
import com.yubico.webauthn.RelyingParty;
import com.yubico.webauthn.StartAssertionOptions;
import com.yubico.webauthn.StartRegistrationOptions;
import com.yubico.webauthn.data.AuthenticatorAssertionResponse;
import com.yubico.webauthn.data.AuthenticatorAttestationResponse;
import com.yubico.webauthn.data.AuthenticatorSelectionCriteria;
import com.yubico.webauthn.data.AuthenticatorTransport;
import com.yubico.webauthn.data.ClientAssertionExtensionOutputs;
import com.yubico.webauthn.data.ClientRegistrationExtensionOutputs;
import com.yubico.webauthn.data.PublicKeyCredential;
import com.yubico.webauthn.data.PublicKeyCredentialCreationOptions;
import com.yubico.webauthn.data.RelyingPartyIdentity;
import com.yubico.webauthn.data.ResidentKeyRequirement;
import com.yubico.webauthn.data.UserIdentity;
import com.yubico.webauthn.data.UserVerificationRequirement;
import com.yubico.webauthn.exception.AssertionFailedException;
import com.yubico.webauthn.exception.RegistrationFailedException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class YubicoCredentialVerifier implements CredentialVerifier {

    private final RelyingPartyIdentity identity;
    private final Set<String> origins;
    private final ObjectMapper webauthnObjectMapper;

    public YubicoCredentialVerifier(RelyingPartyIdentity identity,
                                    WebAuthnProperties properties,
                                    @Qualifier("webauthnObjectMapper") ObjectMapper webauthnObjectMapper) {
        this.identity = identity;
        this.origins = properties.getOrigins().stream()
                .filter(origin -> origin != null && !origin.isBlank())
                .map(String::trim)
                .collect(Collectors.toUnmodifiableSet());
        this.webauthnObjectMapper = webauthnObjectMapper;
    }

    @Override
    public IssuedChallenge startRegistration(PasskeyUser user, List<Passkey> existing) {
        UserIdentity userIdentity = UserIdentity.builder()
                .name(user.email())
                .displayName(user.displayName() != null && !user.displayName().isBlank() ? user.displayName() : user.email())
                .id(SnapshotCredentialRepository.decode(user.userHandle()))
                .build();

        PublicKeyCredentialCreationOptions options = relyingParty(new SnapshotCredentialRepository(user, existing))
                .startRegistration(StartRegistrationOptions.builder()
                        .user(userIdentity)
                        .authenticatorSelection(AuthenticatorSelectionCriteria.builder()
                                .residentKey(ResidentKeyRequirement.PREFERRED)
                                .userVerification(UserVerificationRequirement.PREFERRED)
                                .build())
                        .build());

        try {
            return new IssuedChallenge(options.toJson(), webauthnObjectMapper.valueToTree(options));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not serialize registration options", ex);
        }
    }

    @Override
    public VerifiedCredential finishRegistration(String requestJson, JsonNode credential)
            throws CredentialVerificationException {
        PublicKeyCredentialCreationOptions request;
        try {
            request = PublicKeyCredentialCreationOptions.fromJson(requestJson);
        } catch (JsonProcessingException ex) {
            throw new CredentialVerificationException("Stored registration request is unreadable", ex);
        }

        PublicKeyCredential<AuthenticatorAttestationResponse, ClientRegistrationExtensionOutputs> response =
                parse(credential, new TypeReference<PublicKeyCredential<AuthenticatorAttestationResponse,
                        ClientRegistrationExtensionOutputs>>() { });

        // Duplicate credential ids are rejected by the storage unique index at commit.
        RelyingParty relyingParty = relyingParty(new SnapshotCredentialRepository(null, List.of()));
        try {
            RegistrationResult result = relyingParty.finishRegistration(FinishRegistrationOptions.builder()
                    .request(request)
                    .response(response)
                    .build());

            List<String> transports = result.getKeyId().getTransports()
                    .map(values -> values.stream().map(AuthenticatorTransport::getId).toList())
                    .orElse(List.of());

            return new VerifiedCredential(
                    result.getKeyId().getId().getBase64Url(),
                    result.getPublicKeyCose().getBase64Url(),
                    result.getSignatureCount(),
                    transports);
        } catch (RegistrationFailedException ex) {
            throw new CredentialVerificationException("Registration validation failed", ex);
        }
    }

    @Override
    public IssuedChallenge startAssertion(PasskeyUser user, List<Passkey> passkeys) {
        AssertionRequest request = relyingParty(new SnapshotCredentialRepository(user, passkeys))
                .startAssertion(StartAssertionOptions.builder()
                        .username(user.email())
                        .userVerification(UserVerificationRequirement.PREFERRED)
                        .build());
        try {
            return new IssuedChallenge(request.toJson(),
                    webauthnObjectMapper.valueToTree(request.getPublicKeyCredentialRequestOptions()));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not serialize assertion request", ex);
        }
    }

    @Override
    public VerifiedAssertion finishAssertion(String requestJson, JsonNode credential, PasskeyUser user, Passkey passkey)
            throws CredentialVerificationException {
        AssertionRequest request;
        try {
            request = AssertionRequest.fromJson(requestJson);
        } catch (JsonProcessingException ex) {
            throw new CredentialVerificationException("Stored assertion request is unreadable", ex);
        }

        PublicKeyCredential<AuthenticatorAssertionResponse, ClientAssertionExtensionOutputs> response =
                parse(credential, new TypeReference<PublicKeyCredential<AuthenticatorAssertionResponse,
                        ClientAssertionExtensionOutputs>>() { });

        RelyingParty relyingParty = relyingParty(new SnapshotCredentialRepository(user, List.of(passkey)));
        try {
            AssertionResult result = relyingParty.finishAssertion(FinishAssertionOptions.builder()
                    .request(request)
                    .response(response)
                    .build());
            if (!result.isSuccess()) {
                throw new CredentialVerificationException("Assertion was not successful");
            }
            return new VerifiedAssertion(result.getCredential().getCredentialId().getBase64Url(),
                    result.getSignatureCount());
        } catch (AssertionFailedException ex) {
            throw new CredentialVerificationException("Assertion validation failed", ex);
        }
    }

    private <T> T parse(JsonNode credential, TypeReference<T> type) throws CredentialVerificationException {
        if (credential == null || credential.isNull() || credential.isMissingNode()) {
            throw new CredentialVerificationException("Credential is missing");
        }
        try {
            return webauthnObjectMapper.convertValue(credential, type);
        } catch (IllegalArgumentException ex) {
            throw new CredentialVerificationException("Credential has an invalid shape", ex);
        }
    }

    private RelyingParty relyingParty(CredentialRepository credentialRepository) {
        return RelyingParty.builder()
                .identity(identity)
                .credentialRepository(credentialRepository)
                .origins(origins)
                .validateSignatureCounter(true)
                .build();
    }
}
