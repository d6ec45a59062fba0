package com.example.authservice.service;

import com.example.authservice.domain.Account;
import com.example.authservice.web.dto.AccountResponse;
import com.example.authservice.web.dto.AuthResponse;
import com.example.authservice.web.dto.EmailVerificationResponse;
import com.example.authservice.web.dto.MessageResponse;

import java.util.Optional;
import java.util.UUID;

/**
 * Account lifecycle: registration, email verification, sign-in, password reset and token refresh.
 * Implementations hold no per-request state and are shared across concurrent calls.
 */
public interface AuthService {

    /**
     * Registers a new, unverified account and mails a verification link.
     * If an unverified account already exists for the email, its name and password are replaced,
     * a fresh verification token is issued and mailed, and no second account is created.
     *
     * @throws com.example.authservice.exceptions.ValidationException if the email belongs to a verified
     *                                                                account or the password is too weak
     */
    MessageResponse signup(String email, String name, String password);

    /**
     * Checks the password and the account state, records the login time and issues an access token
     * together with a refresh token.
     *
     * @throws com.example.authservice.exceptions.AuthenticationFailedException on unknown email, wrong
     *                                                                          password, disabled or unverified account
     */
    AuthResponse signin(String email, String password);

    /**
     * Consumes a pending verification token, marks the account verified and signs it in.
     *
     * @throws com.example.authservice.exceptions.ValidationException for an unknown or expired token
     */
    EmailVerificationResponse verifyEmail(String token);

    /**
     * Issues a fresh verification token and mails it. A mail failure is reported to the caller.
     */
    MessageResponse resendVerification(String email);

    /**
     * Issues a password reset token and mails it. The response does not reveal whether the email is known.
     */
    MessageResponse requestPasswordReset(String email);

    MessageResponse resetPassword(String token, String newPassword);

    /**
     * Exchanges a refresh token for a new access token. The refresh token itself stays valid.
     */
    AuthResponse refreshToken(String refreshToken);

    /**
     * Decodes an access token and loads its account. No active or verified check is applied here.
     *
     * @return the account, or empty if the token is invalid or the account no longer exists
     */
    Optional<Account> resolveCurrentUser(String accessToken);

    /**
     * Enables or disables an account.
     */
    AccountResponse setAccountActive(UUID accountId, boolean active);
}
