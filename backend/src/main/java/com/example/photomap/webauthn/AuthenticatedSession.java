package com.example.photomap.webauthn;

import com.example.photomap.model.UserProfile;

public record AuthenticatedSession(UserProfile user, String token) {
}
