package com.example.photomap.dto;

import com.example.photomap.model.Passkey;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.List;

public final class WebAuthnDtos {

    private WebAuthnDtos() {
    }

    public record RegistrationOptionsRequest(
            @NotBlank @Email(message = "Invalid email format") @Size(max = 254) String email,
            @Size(max = 500) String displayName,
            String inviteCode
    ) { }

    public record RegistrationVerifyRequest(
            @NotBlank @Email(message = "Invalid email format") String email,
            @NotNull(message = "Credential is required") JsonNode credential
    ) { }

    public record LoginOptionsRequest(
            @NotBlank @Email(message = "Invalid email format") String email
    ) { }

    public record LoginVerifyRequest(
            @NotBlank @Email(message = "Invalid email format") String email,
            @NotNull(message = "Credential is required") JsonNode credential
    ) { }

    public record PasskeyVerifyRequest(
            @NotNull(message = "Credential is required") JsonNode credential
    ) { }

    /** Wraps the options object handed to the browser. */
    public record OptionsResponse(JsonNode options) { }

    public record PasskeySummary(String id, Instant createdAt, Instant lastUsedAt, List<String> transports) {
        public static PasskeySummary from(Passkey passkey) {
            return new PasskeySummary(passkey.getCredentialId(), passkey.getCreatedAt(), passkey.getLastUsedAt(),
                    passkey.getTransports() == null ? List.of() : passkey.getTransports());
        }
    }

    public record PasskeyListResponse(List<PasskeySummary> passkeys) { }

    public record PasskeyAddedResponse(boolean success, PasskeySummary passkey) { }
}
