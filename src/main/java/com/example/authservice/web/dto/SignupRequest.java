package com.example.authservice.web.dto;

import jakarta.validation.constraints.*;

public record SignupRequest(
        @NotBlank(message = "Email cannot be blank")
        @Email(message = "Email must be a well-formed email address")
        @Size(max = 255)
        String email,

        @NotBlank(message = "Name cannot be blank")
        @Size(min = 2, max = 100, message = "Name size must be between 2 and 100 characters")
        String name,

        @NotBlank(message = "Password cannot be blank")
        @Size(min = 8, max = 100, message = "Password size must be between 8 and 100 characters")
        String password
) {}
