package com.example.authservice.web.dto;

import jakarta.validation.constraints.NotBlank;

public record EmailVerificationRequest(
        @NotBlank(message = "Token cannot be blank")
        String token
) {}
