package com.example.photomap.security;

/** Principal placed in the security context for a request carrying a valid session token. */
public record AuthenticatedUser(String id, String email, boolean admin) {
}
