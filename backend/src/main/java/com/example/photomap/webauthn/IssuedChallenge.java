package com.example.photomap.webauthn;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * @param requestJson request as it must be kept for verification
 * @param publicKey   options handed to {@code navigator.credentials.create/get}
 */
public record IssuedChallenge(String requestJson, JsonNode publicKey) {
}
