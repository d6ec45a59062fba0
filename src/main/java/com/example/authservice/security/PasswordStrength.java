package com.example.authservice.security;

/**
 * Outcome of a password policy check. {@code reason} names the first rule that failed.
 */
public record PasswordStrength(boolean ok, String reason) {

    public static PasswordStrength strong() {
        return new PasswordStrength(true, "Password is strong");
    }

    public static PasswordStrength weak(String reason) {
        return new PasswordStrength(false, reason);
    }
}
