package com.example.photomap.webauthn;

import com.example.photomap.model.Passkey;
import com.yubico.webauthn.CredentialRepository;
import com.yubico.webauthn.RegisteredCredential;
import com.yubico.webauthn.data.AuthenticatorTransport;
import com.yubico.webauthn.data.ByteArray;
import com.yubico.webauthn.data.PublicKeyCredentialDescriptor;
import com.yubico.webauthn.data.PublicKeyCredentialType;
import com.yubico.webauthn.data.exception.Base64UrlException;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link CredentialRepository} over the passkeys of one identity, loaded by the caller before
 * the ceremony. Keeps the relying party free of storage access.
 */
class SnapshotCredentialRepository implements CredentialRepository {

    private final PasskeyUser user;
    private final List<Passkey> passkeys;

    SnapshotCredentialRepository(PasskeyUser user, List<Passkey> passkeys) {
        this.user = user;
        this.passkeys = passkeys == null ? List.of() : List.copyOf(passkeys);
    }

    @Override
    public Set<PublicKeyCredentialDescriptor> getCredentialIdsForUsername(String username) {
        if (!isUser(username)) {
            return Collections.emptySet();
        }
        return passkeys.stream().map(this::toDescriptor).collect(Collectors.toSet());
    }

    @Override
    public Optional<ByteArray> getUserHandleForUsername(String username) {
        if (!isUser(username)) {
            return Optional.empty();
        }
        return Optional.of(decode(user.userHandle()));
    }

    @Override
    public Optional<String> getUsernameForUserHandle(ByteArray userHandle) {
        if (user == null || userHandle == null || !userHandle.getBase64Url().equals(user.userHandle())) {
            return Optional.empty();
        }
        return Optional.of(user.email());
    }

    @Override
    public Optional<RegisteredCredential> lookup(ByteArray credentialId, ByteArray userHandle) {
        if (user == null || credentialId == null) {
            return Optional.empty();
        }
        if (userHandle != null && !userHandle.getBase64Url().equals(user.userHandle())) {
            return Optional.empty();
        }
        return find(credentialId).map(this::toRegisteredCredential);
    }

    @Override
    public Set<RegisteredCredential> lookupAll(ByteArray credentialId) {
        if (user == null || credentialId == null) {
            return Collections.emptySet();
        }
        return find(credentialId).map(this::toRegisteredCredential).map(Set::of).orElseGet(Collections::emptySet);
    }

    private Optional<Passkey> find(ByteArray credentialId) {
        String id = credentialId.getBase64Url();
        return passkeys.stream().filter(passkey -> id.equals(passkey.getCredentialId())).findFirst();
    }

    private boolean isUser(String username) {
        return user != null && username != null
                && Objects.equals(user.email(), username.trim().toLowerCase(Locale.ROOT));
    }

    private RegisteredCredential toRegisteredCredential(Passkey passkey) {
        return RegisteredCredential.builder()
                .credentialId(decode(passkey.getCredentialId()))
                .userHandle(decode(user.userHandle()))
                .publicKeyCose(decode(passkey.getPublicKeyCose()))
                .signatureCount(passkey.getSignCount())
                .build();
    }

    private PublicKeyCredentialDescriptor toDescriptor(Passkey passkey) {
        PublicKeyCredentialDescriptor.PublicKeyCredentialDescriptorBuilder builder = PublicKeyCredentialDescriptor
                .builder()
                .id(decode(passkey.getCredentialId()))
                .type(PublicKeyCredentialType.PUBLIC_KEY);
        if (passkey.getTransports() != null && !passkey.getTransports().isEmpty()) {
            builder.transports(passkey.getTransports().stream()
                    .filter(transport -> transport != null && !transport.isBlank())
                    .map(transport -> AuthenticatorTransport.of(transport.trim().toLowerCase(Locale.ROOT)))
                    .collect(Collectors.toSet()));
        }
        return builder.build();
    }

    static ByteArray decode(String base64Url) {
        try {
            return ByteArray.fromBase64Url(base64Url);
        } catch (Base64UrlException ex) {
            throw new IllegalStateException("Stored WebAuthn value is not valid base64url", ex);
        }
    }
}
