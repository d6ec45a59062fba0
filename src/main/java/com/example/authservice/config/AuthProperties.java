package com.example.authservice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Immutable settings for token signing, single-use account tokens and outgoing mail.
 * Bound once from {@code app.auth.*} and handed to the services that need it.
 */
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(Jwt jwt, Tokens tokens, Mail mail) {

    public AuthProperties {
        if (jwt == null) {
            throw new IllegalArgumentException("JWT settings (app.auth.jwt) must be provided");
        }
        if (tokens == null) {
            tokens = new Tokens(null, null, null);
        }
        if (mail == null) {
            mail = new Mail(null, null, null);
        }
    }

    /**
     * Signing key and lifetimes of the signed tokens.
     *
     * @param secretBase64         Base64 encoded HMAC key, at least 256 bits once decoded
     * @param issuer               value of the {@code iss} claim
     * @param accessTokenTtl       lifetime of access tokens
     * @param refreshTokenTtl      lifetime of refresh tokens
     * @param emailVerificationTtl lifetime of signed email verification tokens
     * @param passwordResetTtl     lifetime of signed password reset tokens
     */
    public record Jwt(String secretBase64,
                      String issuer,
                      @DefaultValue("PT30M") Duration accessTokenTtl,
                      @DefaultValue("P7D") Duration refreshTokenTtl,
                      @DefaultValue("PT24H") Duration emailVerificationTtl,
                      @DefaultValue("PT1H") Duration passwordResetTtl) {

        public Jwt {
            if (issuer == null || issuer.trim().isEmpty()) {
                throw new IllegalArgumentException("JWT Issuer (app.auth.jwt.issuer) must not be null or empty");
            }
            accessTokenTtl = requirePositive(accessTokenTtl, Duration.ofMinutes(30), "access-token-ttl");
            refreshTokenTtl = requirePositive(refreshTokenTtl, Duration.ofDays(7), "refresh-token-ttl");
            emailVerificationTtl = requirePositive(emailVerificationTtl, Duration.ofHours(24), "email-verification-ttl");
            passwordResetTtl = requirePositive(passwordResetTtl, Duration.ofHours(1), "password-reset-ttl");
        }
    }

    /**
     * Random tokens stored on the account and mailed to its owner.
     */
    public record Tokens(@DefaultValue("PT24H") Duration verificationTtl,
                         @DefaultValue("PT1H") Duration resetTtl,
                         @DefaultValue("32") Integer length) {

        public Tokens {
            verificationTtl = requirePositive(verificationTtl, Duration.ofHours(24), "verification-ttl");
            resetTtl = requirePositive(resetTtl, Duration.ofHours(1), "reset-ttl");
            if (length == null) {
                length = 32;
            } else if (length < 16) {
                throw new IllegalArgumentException("Token length (app.auth.tokens.length) must be at least 16");
            }
        }
    }

    public record Mail(@DefaultValue("noreply@example.com") String fromAddress,
                       @DefaultValue("Auth Service") String fromName,
                       @DefaultValue("http://localhost:3000") String baseUrl) {

        public Mail {
            if (fromAddress == null || fromAddress.isBlank()) {
                fromAddress = "noreply@example.com";
            }
            if (fromName == null || fromName.isBlank()) {
                fromName = "Auth Service";
            }
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = "http://localhost:3000";
            } else if (baseUrl.endsWith("/")) {
                baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
            }
        }
    }

    private static Duration requirePositive(Duration value, Duration fallback, String name) {
        if (value == null) {
            return fallback;
        }
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException("Duration (" + name + ") must be positive");
        }
        return value;
    }
}
