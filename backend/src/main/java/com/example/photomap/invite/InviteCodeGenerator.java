package com.example.photomap.invite;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.regex.Pattern;

/** 24 random bytes as URL-safe base64 without padding: always 32 characters. */
@Component
public class InviteCodeGenerator {

    static final int CODE_BYTES = 24;
    public static final Pattern CODE_FORMAT = Pattern.compile("^[A-Za-z0-9_-]{32}$");

    private final SecureRandom secureRandom = new SecureRandom();

    public String generate() {
        byte[] bytes = new byte[CODE_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    public static boolean isWellFormed(String code) {
        return code != null && CODE_FORMAT.matcher(code).matches();
    }
}
