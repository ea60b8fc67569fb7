package com.example.photomap.access;

import com.example.photomap.model.TripRole;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EffectiveRole {
    ADMIN,
    EDITOR,
    VIEWER;

    public static EffectiveRole of(TripRole role) {
        return role == TripRole.EDITOR ? EDITOR : VIEWER;
    }

    public boolean canEdit() {
        return this != VIEWER;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
