package com.example.authservice.web.controller;

import com.example.authservice.domain.Account;
import com.example.authservice.service.AuthService;
import com.example.authservice.web.dto.AccountResponse;
import com.example.authservice.web.dto.AuthResponse;
import com.example.authservice.web.dto.EmailVerificationRequest;
import com.example.authservice.web.dto.EmailVerificationResponse;
import com.example.authservice.web.dto.ForgotPasswordRequest;
import com.example.authservice.web.dto.MessageResponse;
import com.example.authservice.web.dto.RefreshTokenRequest;
import com.example.authservice.web.dto.ResendVerificationRequest;
import com.example.authservice.web.dto.ResetPasswordRequest;
import com.example.authservice.web.dto.SigninRequest;
import com.example.authservice.web.dto.SignupRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {
    private static final Logger log = LoggerFactory.getLogger(AuthController.class);
    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/signup")
    public ResponseEntity<MessageResponse> signup(@Valid @RequestBody SignupRequest request) {
        MessageResponse response = authService.signup(request.email(), request.name(), request.password());
        // 201 also for the re-issue branch, so callers cannot tell the two apart
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/signin")
    public ResponseEntity<AuthResponse> signin(@Valid @RequestBody SigninRequest request) {
        return ResponseEntity.ok(authService.signin(request.email(), request.password()));
    }

    @PostMapping("/verify-email")
    public ResponseEntity<EmailVerificationResponse> verifyEmail(@Valid @RequestBody EmailVerificationRequest request) {
        return ResponseEntity.ok(authService.verifyEmail(request.token()));
    }

    @PostMapping("/resend-verification")
    public ResponseEntity<MessageResponse> resendVerification(@Valid @RequestBody ResendVerificationRequest request) {
        log.info("Received request to resend verification email for: {}", request.email());
        return ResponseEntity.ok(authService.resendVerification(request.email()));
    }

    @PostMapping("/forgot-password")
    public ResponseEntity<MessageResponse> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        return ResponseEntity.ok(authService.requestPasswordReset(request.email()));
    }

    @PostMapping("/reset-password")
    public ResponseEntity<MessageResponse> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        return ResponseEntity.ok(authService.resetPassword(request.token(), request.newPassword()));
    }

    @PostMapping("/refresh-token")
    public ResponseEntity<AuthResponse> refreshToken(@Valid @RequestBody RefreshTokenRequest request) {
        return ResponseEntity.ok(authService.refreshToken(request.refreshToken()));
    }

    /**
     * The principal is placed in the security context by the authentication filter,
     * which already rejected disabled and unverified accounts.
     */
    @GetMapping("/me")
    public ResponseEntity<AccountResponse> currentUser(@AuthenticationPrincipal Account account) {
        return ResponseEntity.ok(AccountResponse.from(account));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "healthy", "service", "auth"));
    }
}
