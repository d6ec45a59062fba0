package com.example.authservice.security;

import java.time.Instant;

/**
 * Decoded content of a signed token. {@code subject} and {@code name} are null for
 * email verification and password reset tokens.
 */
public record TokenClaims(String subject, TokenPurpose purpose, String email, String name, Instant expiresAt) {
}
