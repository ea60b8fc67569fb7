package com.example.photomap.webauthn;

import java.util.List;

public record VerifiedCredential(String credentialId, String publicKeyCose, long signCount, List<String> transports) {
}
