package com.example.authservice.security;

import com.example.authservice.config.AuthProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.Optional;

/**
 * Issues and validates HS256 signed tokens scoped to a {@link TokenPurpose}.
 * Holds only the signing key and lifetimes, so one instance is shared by all requests.
 */
@Component
public class JwtService {
    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    public static final String TYPE_CLAIM = "type";
    public static final String EMAIL_CLAIM = "email";
    public static final String NAME_CLAIM = "name";

    private final SecretKey key;
    private final String issuer;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Duration emailVerificationTtl;
    private final Duration passwordResetTtl;

    public JwtService(AuthProperties properties) {
        AuthProperties.Jwt jwt = properties.jwt();
        this.key = initializeKey(jwt.secretBase64());
        this.issuer = jwt.issuer();
        this.accessTokenTtl = jwt.accessTokenTtl();
        this.refreshTokenTtl = jwt.refreshTokenTtl();
        this.emailVerificationTtl = jwt.emailVerificationTtl();
        this.passwordResetTtl = jwt.passwordResetTtl();
        log.info("JWT Service Initializing. Issuer: {}, access TTL: {}, refresh TTL: {}",
                issuer, accessTokenTtl, refreshTokenTtl);
    }

    private static SecretKey initializeKey(String base64Secret) {
        if (!StringUtils.hasText(base64Secret)) {
            log.error("CRITICAL: JWT Secret Key (app.auth.jwt.secret-base64 or JWT_SECRET_BASE64 env var) is missing or empty!");
            throw new IllegalArgumentException("JWT Secret Key (app.auth.jwt.secret-base64) must be provided via properties or environment variable (JWT_SECRET_BASE64)");
        }

        byte[] decodedKey;
        try {
            decodedKey = Base64.getDecoder().decode(base64Secret.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid Base64 encoding for JWT secret key (app.auth.jwt.secret-base64)", e);
        }
        if (decodedKey.length < 32) {
            log.error("CRITICAL: Provided JWT secret key is too short ({} bytes). Must be at least 256 bits (32 bytes).", decodedKey.length);
            throw new IllegalArgumentException("JWT Secret key must be at least 256 bits (32 bytes)");
        }
        return Keys.hmacShaKeyFor(decodedKey);
    }

    public String issueAccess(String accountId, String email, String name) {
        return issueIdentityToken(TokenPurpose.ACCESS, accountId, email, name, accessTokenTtl);
    }

    public String issueRefresh(String accountId, String email, String name) {
        return issueIdentityToken(TokenPurpose.REFRESH, accountId, email, name, refreshTokenTtl);
    }

    /**
     * Carries only the email; the account is located by token value, not by identity.
     */
    public String issueEmailVerification(String email) {
        return issueEmailToken(TokenPurpose.EMAIL_VERIFICATION, email, emailVerificationTtl);
    }

    public String issuePasswordReset(String email) {
        return issueEmailToken(TokenPurpose.PASSWORD_RESET, email, passwordResetTtl);
    }

    /**
     * Checks signature, issuer and expiry.
     *
     * @return the decoded claims, or empty for any invalid token (expired and tampered are not told apart)
     */
    public Optional<TokenClaims> verify(String token) {
        if (!StringUtils.hasText(token)) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .requireIssuer(issuer)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            Optional<TokenPurpose> purpose = TokenPurpose.fromClaim(claims.get(TYPE_CLAIM, String.class));
            if (purpose.isEmpty() || claims.getExpiration() == null) {
                log.warn("JWT rejected: missing purpose or expiration claim.");
                return Optional.empty();
            }
            return Optional.of(new TokenClaims(
                    claims.getSubject(),
                    purpose.get(),
                    claims.get(EMAIL_CLAIM, String.class),
                    claims.get(NAME_CLAIM, String.class),
                    claims.getExpiration().toInstant()));
        } catch (JwtException e) {
            log.warn("JWT validation failed: {}", e.getMessage());
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            log.warn("Invalid token format or claim issue: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * As {@link #verify(String)}, and the token's purpose must equal {@code expected}.
     */
    public Optional<TokenClaims> verifyPurpose(String token, TokenPurpose expected) {
        Optional<TokenClaims> claims = verify(token).filter(c -> c.purpose() == expected);
        if (claims.isEmpty()) {
            log.debug("Token rejected for purpose {}", expected.claimValue());
        }
        return claims;
    }

    public Duration accessTokenTtl() {
        return accessTokenTtl;
    }

    private String issueIdentityToken(TokenPurpose purpose, String accountId, String email, String name, Duration ttl) {
        if (accountId == null || accountId.trim().isEmpty()) {
            throw new IllegalArgumentException("Account id must not be null or empty");
        }
        Instant now = Instant.now();
        Instant expirationInstant = now.plus(ttl);

        String token = Jwts.builder()
                .subject(accountId)
                .issuer(issuer)
                .claim(TYPE_CLAIM, purpose.claimValue())
                .claim(EMAIL_CLAIM, email)
                .claim(NAME_CLAIM, name)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expirationInstant))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
        log.debug("Generated {} token for account '{}', expires at {}", purpose.claimValue(), accountId, expirationInstant);
        return token;
    }

    private String issueEmailToken(TokenPurpose purpose, String email, Duration ttl) {
        if (email == null || email.trim().isEmpty()) {
            throw new IllegalArgumentException("Email must not be null or empty");
        }
        Instant now = Instant.now();
        Instant expirationInstant = now.plus(ttl);

        String token = Jwts.builder()
                .issuer(issuer)
                .claim(TYPE_CLAIM, purpose.claimValue())
                .claim(EMAIL_CLAIM, email)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expirationInstant))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
        log.debug("Generated {} token, expires at {}", purpose.claimValue(), expirationInstant);
        return token;
    }
}
