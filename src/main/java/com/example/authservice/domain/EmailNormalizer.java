package com.example.authservice.domain;

import java.util.Locale;

/**
 * Canonical form of an email address used for storage and lookup.
 */
public final class EmailNormalizer {

    private EmailNormalizer() {
    }

    public static String normalize(String email) {
        if (email == null) {
            return null;
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
