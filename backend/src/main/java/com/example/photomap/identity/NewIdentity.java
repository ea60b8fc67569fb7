package com.example.photomap.identity;

public record NewIdentity(String email, String userHandle, String displayName) {
}
