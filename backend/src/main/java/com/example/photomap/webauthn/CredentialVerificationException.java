package com.example.photomap.webauthn;

/** A client response that did not verify. The message is for logs, never for clients. */
public class CredentialVerificationException extends Exception {

    public CredentialVerificationException(String message) {
        super(message);
    }

    public CredentialVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
