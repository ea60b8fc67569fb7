package com.example.photomap.webauthn;

/** The identity side of a ceremony as the authenticator sees it. */
public record PasskeyUser(String userHandle, String email, String displayName) {
}
