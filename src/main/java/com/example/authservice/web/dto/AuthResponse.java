package com.example.authservice.web.dto;

/**
 * Result of sign-in and token refresh. {@code refreshToken} is null when no new one was issued.
 */
public record AuthResponse(
        String message,
        AccountResponse user,
        String accessToken,
        String refreshToken,
        String tokenType,
        long expiresIn
) {
    public static final String TOKEN_TYPE = "bearer";
}
