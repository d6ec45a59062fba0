package com.example.authservice.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResetPasswordRequest(
        @NotBlank(message = "Token cannot be blank")
        String token,

        @NotBlank(message = "Password cannot be blank")
        @Size(min = 8, max = 100, message = "Password size must be between 8 and 100 characters")
        String newPassword
) {}
