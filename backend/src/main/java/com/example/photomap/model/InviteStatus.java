package com.example.photomap.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum InviteStatus {
    PENDING,
    USED,
    REVOKED,
    EXPIRED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
