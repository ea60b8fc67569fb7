package com.example.photomap.webauthn;

import com.example.photomap.exceptions.PhotoMapException;
import com.example.photomap.model.Passkey;
import com.example.photomap.model.UserProfile;
import com.example.photomap.support.FakeCredentialVerifier;
import com.example.photomap.support.PasskeyTestBed;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

class LoginServiceTest {

    private PasskeyTestBed bed;
    private UserProfile owner;

    @BeforeEach
    void setUp() {
        bed = new PasskeyTestBed();
        bed.inviteProps.setRequiredAfterFirstUser(false);
        owner = bed.register("owner@example.com", "cred-owner").user();
    }

    @Test
    void loginIssuesTokenAndRecordsUse() {
        bed.clock.advanceSeconds(30);

        AuthenticatedSession session = bed.login("Owner@Example.com", "cred-owner");

        assertThat(session.user().getId()).isEqualTo(owner.getId());
        assertThat(bed.jwtService.validate(session.token()).id()).isEqualTo(owner.getId());
        Passkey passkey = bed.passkeys.findByCredentialId("cred-owner").orElseThrow();
        assertThat(passkey.getSignCount()).isEqualTo(1);
        assertThat(passkey.getLastUsedAt()).isEqualTo(bed.clock.instant());
        verify(bed.audit).recordPasskeyAuthenticationSuccess(owner.getId());
    }

    @Test
    void optionsListOnlyTheIdentitysPasskeys() {
        bed.register("second@example.com", "cred-second");

        JsonNode options = bed.loginService.startLogin("owner@example.com");

        assertThat(options.path("allowCredentials").size()).isEqualTo(1);
        assertThat(options.path("allowCredentials").get(0).path("id").asText()).isEqualTo("cred-owner");
    }

    @Test
    void unknownEmailAndEmailWithoutPasskeysFailAlike() {
        UserProfile second = bed.register("second@example.com", "cred-second").user();
        bed.passkeys.deleteByUserId(second.getId());

        assertThatThrownBy(() -> bed.loginService.startLogin("nobody@example.com"))
                .isInstanceOf(PhotoMapException.class)
                .hasMessage("Authentication failed")
                .extracting("error")
                .isEqualTo(PhotoMapException.Errors.AUTHENTICATION_FAILED);
        assertThatThrownBy(() -> bed.loginService.startLogin("second@example.com"))
                .isInstanceOf(PhotoMapException.class)
                .hasMessage("Authentication failed")
                .extracting("error")
                .isEqualTo(PhotoMapException.Errors.AUTHENTICATION_FAILED);
    }

    @Test
    void credentialOfAnotherIdentityIsRejected() {
        bed.register("second@example.com", "cred-second");
        JsonNode options = bed.loginService.startLogin("owner@example.com");

        assertThatThrownBy(() -> bed.loginService.finishLogin("owner@example.com",
                FakeCredentialVerifier.assertionResponse(options, "cred-second")))
                .extracting("error")
                .isEqualTo(PhotoMapException.Errors.AUTHENTICATION_FAILED);
        verify(bed.audit, atLeastOnce()).recordPasskeyAuthenticationFailure(anyString());
    }

    @Test
    void registrationChallengeCannotCompleteLogin() {
        bed.passkeys.deleteByUserId(owner.getId());
        JsonNode options = bed.registrationService.startRegistration("owner@example.com", null, null);

        assertThatThrownBy(() -> bed.loginService.finishLogin("owner@example.com",
                FakeCredentialVerifier.assertionResponse(options, "cred-owner")))
                .extracting("error")
                .isEqualTo(PhotoMapException.Errors.AUTHENTICATION_FAILED);
    }

    @Test
    void failedAssertionConsumesTheChallenge() {
        JsonNode options = bed.loginService.startLogin("owner@example.com");
        ObjectNode forged = (ObjectNode) FakeCredentialVerifier.assertionResponse(options, "cred-owner");
        forged.put("challenge", "forged");

        assertThatThrownBy(() -> bed.loginService.finishLogin("owner@example.com", forged))
                .extracting("error")
                .isEqualTo(PhotoMapException.Errors.AUTHENTICATION_FAILED);
        assertThatThrownBy(() -> bed.loginService.finishLogin("owner@example.com",
                FakeCredentialVerifier.assertionResponse(options, "cred-owner")))
                .extracting("error")
                .isEqualTo(PhotoMapException.Errors.AUTHENTICATION_FAILED);
    }
}
