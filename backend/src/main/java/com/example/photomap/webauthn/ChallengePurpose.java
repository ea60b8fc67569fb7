package com.example.photomap.webauthn;

public enum ChallengePurpose {
    REGISTRATION,
    ADD_PASSKEY,
    LOGIN
}
