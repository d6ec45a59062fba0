package com.example.authservice.security;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.List;
import java.util.Locale;

/**
 * Password hashing, password policy and random token generation.
 */
@Component
public class CredentialHasher {

    static final int MIN_PASSWORD_LENGTH = 8;
    static final List<String> COMMON_PATTERNS = List.of("123456", "qwerty", "abc123");

    private static final char[] TOKEN_ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789".toCharArray();

    private final PasswordEncoder passwordEncoder;
    private final SecureRandom secureRandom = new SecureRandom();
    private final String unknownAccountHash;

    public CredentialHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
        this.unknownAccountHash = passwordEncoder.encode(generateSecureToken(32));
    }

    /**
     * Salted one-way hash; two calls with the same input give different results.
     */
    public String hash(String password) {
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("Password must not be null or empty");
        }
        return passwordEncoder.encode(password);
    }

    /**
     * @return true if {@code password} produced {@code hash}; false for any null input or malformed hash
     */
    public boolean verify(String password, String hash) {
        if (password == null || hash == null || hash.isBlank()) {
            return false;
        }
        return passwordEncoder.matches(password, hash);
    }

    /**
     * Runs one full comparison against a throwaway hash so a lookup miss costs as much as a wrong password.
     *
     * @return always false
     */
    public boolean verifyUnknownAccount(String password) {
        passwordEncoder.matches(password == null ? "" : password, unknownAccountHash);
        return false;
    }

    /**
     * Random token of letters and digits drawn from a {@link SecureRandom}.
     */
    public String generateSecureToken(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Token length must be positive");
        }
        char[] token = new char[length];
        for (int i = 0; i < length; i++) {
            token[i] = TOKEN_ALPHABET[secureRandom.nextInt(TOKEN_ALPHABET.length)];
        }
        return new String(token);
    }

    public PasswordStrength checkStrength(String password) {
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            return PasswordStrength.weak("Password must be at least " + MIN_PASSWORD_LENGTH + " characters long");
        }
        if (password.chars().noneMatch(Character::isUpperCase)) {
            return PasswordStrength.weak("Password must contain at least one uppercase letter");
        }
        if (password.chars().noneMatch(Character::isLowerCase)) {
            return PasswordStrength.weak("Password must contain at least one lowercase letter");
        }
        if (password.chars().noneMatch(Character::isDigit)) {
            return PasswordStrength.weak("Password must contain at least one number");
        }
        String lowered = password.toLowerCase(Locale.ROOT);
        if (COMMON_PATTERNS.stream().anyMatch(lowered::contains)) {
            return PasswordStrength.weak("Password contains common patterns");
        }
        return PasswordStrength.strong();
    }
}
