package com.example.authservice.security;

import java.util.Arrays;
import java.util.Optional;

/**
 * What a signed token may be used for. The claim value is embedded as {@code type}.
 */
public enum TokenPurpose {
    ACCESS("access"),
    REFRESH("refresh"),
    EMAIL_VERIFICATION("email_verification"),
    PASSWORD_RESET("password_reset");

    private final String claimValue;

    TokenPurpose(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    public static Optional<TokenPurpose> fromClaim(String value) {
        return Arrays.stream(values())
                .filter(p -> p.claimValue.equals(value))
                .findFirst();
    }
}
