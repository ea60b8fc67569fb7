package com.example.photomap.identity;

import java.util.Locale;

public final class Emails {

    private Emails() {
    }

    /** Trimmed, lower case; the form every email is stored and looked up in. */
    public static String normalize(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
