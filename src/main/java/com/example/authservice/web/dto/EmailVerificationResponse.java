package com.example.authservice.web.dto;

public record EmailVerificationResponse(
        String message,
        boolean verified,
        String accessToken,
        String tokenType,
        long expiresIn
) {}
