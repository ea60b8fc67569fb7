package com.example.photomap.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Per-trip role of a non-admin identity. */
public enum TripRole {
    EDITOR,
    VIEWER;

    public static final String PATTERN = "editor|viewer";

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TripRole fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Role is required");
        }
        return TripRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
