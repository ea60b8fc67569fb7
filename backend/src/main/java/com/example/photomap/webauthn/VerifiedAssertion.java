package com.example.photomap.webauthn;

public record VerifiedAssertion(String credentialId, long signCount) {
}
