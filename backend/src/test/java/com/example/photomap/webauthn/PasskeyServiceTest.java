package com.example.photomap.webauthn;

import com.example.photomap.exceptions.PhotoMapException;
import com.example.photomap.model.Passkey;
import com.example.photomap.model.UserProfile;
import com.example.photomap.security.AuthenticatedUser;
import com.example.photomap.support.FakeCredentialVerifier;
import com.example.photomap.support.PasskeyTestBed;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

class PasskeyServiceTest {

    private PasskeyTestBed bed;
    private AuthenticatedUser principal;

    @BeforeEach
    void setUp() {
        bed = new PasskeyTestBed();
        UserProfile owner = bed.register("owner@example.com", "cred-1").user();
        principal = new AuthenticatedUser(owner.getId(), owner.getEmail(), owner.isAdmin());
    }

    @Test
    void addPasskeyExcludesExistingCredentials() {
        JsonNode options = bed.passkeyService.startAddPasskey(principal);
        assertThat(bed.verifier.lastExcluded()).extracting(Passkey::getCredentialId).containsExactly("cred-1");

        Passkey added = bed.passkeyService.finishAddPasskey(principal,
                FakeCredentialVerifier.registrationResponse(options, "cred-2"));

        assertThat(added.getUserId()).isEqualTo(principal.id());
        assertThat(bed.passkeyService.list(principal))
                .extracting(Passkey::getCredentialId)
                .containsExactlyInAnyOrder("cred-1", "cred-2");
        verify(bed.audit).recordPasskeyRegistered(principal.id(), "cred-2");
    }

    @Test
    void addPasskeyWithoutOptionsFails() {
        JsonNode stale = bed.passkeyService.startAddPasskey(principal);
        bed.challengeStore.clear("owner@example.com");

        assertThatThrownBy(() -> bed.passkeyService.finishAddPasskey(principal,
                FakeCredentialVerifier.registrationResponse(stale, "cred-2")))
                .isInstanceOf(PhotoMapException.class)
                .extracting("error")
                .isEqualTo(PhotoMapException.Errors.CHALLENGE_EXPIRED);
    }

    @Test
    void lastPasskeyCannotBeDeleted() {
        assertThatThrownBy(() -> bed.passkeyService.delete(principal, "cred-1"))
                .isInstanceOf(PhotoMapException.class)
                .hasMessage("Cannot delete your only passkey")
                .extracting("error")
                .isEqualTo(PhotoMapException.Errors.LAST_PASSKEY);
        assertThat(bed.passkeys.countByUserId(principal.id())).isEqualTo(1);
    }

    @Test
    void deleteRemovesOneOfSeveralPasskeys() {
        JsonNode options = bed.passkeyService.startAddPasskey(principal);
        bed.passkeyService.finishAddPasskey(principal, FakeCredentialVerifier.registrationResponse(options, "cred-2"));

        bed.passkeyService.delete(principal, "cred-1");

        assertThat(bed.passkeyService.list(principal)).extracting(Passkey::getCredentialId).containsExactly("cred-2");
        verify(bed.audit).recordPasskeyDeleted(principal.id(), "cred-1");
    }

    @Test
    void cannotDeleteAnotherIdentitysPasskey() {
        bed.inviteProps.setRequiredAfterFirstUser(false);
        bed.register("other@example.com", "cred-other");
        JsonNode options = bed.passkeyService.startAddPasskey(principal);
        bed.passkeyService.finishAddPasskey(principal, FakeCredentialVerifier.registrationResponse(options, "cred-2"));

        assertThatThrownBy(() -> bed.passkeyService.delete(principal, "cred-other"))
                .isInstanceOf(PhotoMapException.class)
                .extracting("error")
                .isEqualTo(PhotoMapException.Errors.NOT_FOUND);
        assertThat(bed.passkeys.findByCredentialId("cred-other")).isPresent();
    }
}
