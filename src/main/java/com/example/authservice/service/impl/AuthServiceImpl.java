package com.example.authservice.service.impl;

import com.example.authservice.config.AuthProperties;
import com.example.authservice.domain.Account;
import com.example.authservice.domain.EmailNormalizer;
import com.example.authservice.events.AccountMailEvent;
import com.example.authservice.exceptions.AuthenticationFailedException;
import com.example.authservice.exceptions.ValidationException;
import com.example.authservice.repository.AccountRepository;
import com.example.authservice.security.CredentialHasher;
import com.example.authservice.security.JwtService;
import com.example.authservice.security.PasswordStrength;
import com.example.authservice.security.TokenClaims;
import com.example.authservice.security.TokenPurpose;
import com.example.authservice.service.AuthService;
import com.example.authservice.service.EmailService;
import com.example.authservice.web.dto.AccountResponse;
import com.example.authservice.web.dto.AuthResponse;
import com.example.authservice.web.dto.EmailVerificationResponse;
import com.example.authservice.web.dto.MessageResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BooleanSupplier;

@Service
public class AuthServiceImpl implements AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthServiceImpl.class);

    static final String ALREADY_REGISTERED_MESSAGE = "Email already registered";
    static final String REGISTERED_MESSAGE = "User registered successfully. Please check your email for verification.";
    static final String VERIFICATION_RESENT_ON_SIGNUP_MESSAGE = "Verification email sent. Please check your email for verification.";
    static final String INVALID_CREDENTIALS_MESSAGE = "Invalid email or password";
    static final String ACCOUNT_DISABLED_MESSAGE = "Account is disabled";
    static final String NOT_VERIFIED_MESSAGE = "Please verify your email before signing in";
    static final String INVALID_VERIFICATION_TOKEN_MESSAGE = "Invalid or expired verification token";
    static final String INVALID_RESET_TOKEN_MESSAGE = "Invalid or expired reset token";
    static final String INVALID_REFRESH_TOKEN_MESSAGE = "Invalid refresh token";
    static final String RESET_REQUESTED_MESSAGE = "If an account exists for this email, a password reset link has been sent.";

    private final AccountRepository accountRepository;
    private final CredentialHasher credentialHasher;
    private final JwtService jwtService;
    private final EmailService emailService;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final AuthProperties.Tokens tokenProperties;

    public AuthServiceImpl(AccountRepository accountRepository,
                           CredentialHasher credentialHasher,
                           JwtService jwtService,
                           EmailService emailService,
                           ApplicationEventPublisher eventPublisher,
                           TransactionTemplate transactionTemplate,
                           AuthProperties properties) {
        this.accountRepository = accountRepository;
        this.credentialHasher = credentialHasher;
        this.jwtService = jwtService;
        this.emailService = emailService;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = transactionTemplate;
        this.tokenProperties = properties.tokens();
    }

    @Override
    @Transactional
    public MessageResponse signup(String rawEmail, String name, String password) {
        String email = EmailNormalizer.normalize(rawEmail);
        log.info("Attempting registration for email: {}", email);

        Optional<Account> existing = accountRepository.findByEmail(email);
        if (existing.isPresent()) {
            Account account = existing.get();
            if (account.isVerified()) {
                log.warn("Registration failed: email '{}' belongs to a verified account.", email);
                throw new ValidationException(ALREADY_REGISTERED_MESSAGE);
            }
            // Abandoned signup: the new submission replaces the old one.
            requireStrongPassword(password);
            account.setPasswordHash(credentialHasher.hash(password));
            account.setName(name);
            String rawToken = issueVerificationToken(account);
            Account saved = accountRepository.save(account);
            log.info("Re-issued verification token for unverified account {}.", saved.getId());

            eventPublisher.publishEvent(
                    AccountMailEvent.verification(this, saved.getId(), saved.getEmail(), saved.getName(), rawToken));
            return MessageResponse.ok(VERIFICATION_RESENT_ON_SIGNUP_MESSAGE);
        }

        requireStrongPassword(password);
        Account account = new Account(email, name, credentialHasher.hash(password));
        String rawToken = issueVerificationToken(account);
        Account saved = accountRepository.save(account);
        log.info("Successfully registered new account with ID: {}. Verification pending.", saved.getId());

        eventPublisher.publishEvent(
                AccountMailEvent.verification(this, saved.getId(), saved.getEmail(), saved.getName(), rawToken));
        return MessageResponse.ok(REGISTERED_MESSAGE);
    }

    @Override
    @Transactional
    public AuthResponse signin(String rawEmail, String password) {
        String email = EmailNormalizer.normalize(rawEmail);

        Account account = accountRepository.findByEmail(email).orElse(null);
        boolean passwordMatches = account != null
                ? credentialHasher.verify(password, account.getPasswordHash())
                : credentialHasher.verifyUnknownAccount(password);
        if (!passwordMatches) {
            log.warn("Sign-in rejected: bad credentials for email '{}'.", email);
            throw new AuthenticationFailedException(INVALID_CREDENTIALS_MESSAGE);
        }
        if (!account.isActive()) {
            log.warn("Sign-in rejected: account {} is disabled.", account.getId());
            throw new AuthenticationFailedException(ACCOUNT_DISABLED_MESSAGE);
        }
        if (!account.isVerified()) {
            log.warn("Sign-in rejected: account {} is not verified.", account.getId());
            throw new AuthenticationFailedException(NOT_VERIFIED_MESSAGE);
        }

        account.setLastLoginAt(Instant.now());
        Account saved = accountRepository.save(account);
        log.info("Sign-in successful for account {}.", saved.getId());

        String subject = saved.getId().toString();
        return new AuthResponse(
                "Sign in successful",
                AccountResponse.from(saved),
                jwtService.issueAccess(subject, saved.getEmail(), saved.getName()),
                jwtService.issueRefresh(subject, saved.getEmail(), saved.getName()),
                AuthResponse.TOKEN_TYPE,
                jwtService.accessTokenTtl().toSeconds());
    }

    @Override
    @Transactional
    public EmailVerificationResponse verifyEmail(String token) {
        if (token == null || token.isBlank()) {
            log.warn("Verification attempt with blank token.");
            throw new ValidationException(INVALID_VERIFICATION_TOKEN_MESSAGE);
        }

        // Unknown and expired tokens are reported identically.
        Account account = accountRepository.findByValidVerificationToken(token)
                .orElseThrow(() -> {
                    log.warn("Verification failed: token unknown or expired.");
                    return new ValidationException(INVALID_VERIFICATION_TOKEN_MESSAGE);
                });

        account.markVerified(Instant.now());
        Account saved = accountRepository.save(account);
        log.info("Successfully verified email for account {}.", saved.getId());

        eventPublisher.publishEvent(AccountMailEvent.welcome(this, saved.getId(), saved.getEmail(), saved.getName()));

        return new EmailVerificationResponse(
                "Email verified successfully. You are now signed in.",
                true,
                jwtService.issueAccess(saved.getId().toString(), saved.getEmail(), saved.getName()),
                AuthResponse.TOKEN_TYPE,
                jwtService.accessTokenTtl().toSeconds());
    }

    /**
     * Commits the new token before mailing it, so a failed send leaves the account ready for another resend.
     */
    @Override
    public MessageResponse resendVerification(String rawEmail) {
        String email = EmailNormalizer.normalize(rawEmail);

        PendingMail pending = transactionTemplate.execute(status -> {
            Account account = accountRepository.findByEmail(email)
                    .orElseThrow(() -> {
                        log.info("Resend verification request for unknown email: {}.", email);
                        return new ValidationException("User not found");
                    });
            if (account.isVerified()) {
                log.info("Resend verification request for already verified account {}.", account.getId());
                throw new ValidationException("Email already verified");
            }
            if (account.isVerificationPending()) {
                log.info("Replacing earlier verification token for account {}.", account.getId());
            }

            String rawToken = issueVerificationToken(account);
            return new PendingMail(accountRepository.save(account), rawToken);
        });
        Account saved = pending.account();
        String rawToken = pending.token();
        log.info("Resending verification email for account {}.", saved.getId());

        sendOrFail(() -> emailService.sendVerificationEmail(saved.getEmail(), saved.getName(), rawToken),
                "Failed to send verification email", saved);
        return MessageResponse.ok("Verification email sent successfully");
    }

    @Override
    public MessageResponse requestPasswordReset(String rawEmail) {
        String email = EmailNormalizer.normalize(rawEmail);

        PendingMail pending = transactionTemplate.execute(status -> {
            Optional<Account> existing = accountRepository.findByEmail(email);
            if (existing.isEmpty()) {
                return null;
            }
            Account account = existing.get();
            if (account.isResetPending()) {
                log.info("Replacing earlier reset token for account {}.", account.getId());
            }
            String rawToken = credentialHasher.generateSecureToken(tokenProperties.length());
            account.issueResetToken(rawToken, Instant.now().plus(tokenProperties.resetTtl()));
            return new PendingMail(accountRepository.save(account), rawToken);
        });
        if (pending == null) {
            log.info("Password reset requested for unknown email: {}. No action taken.", email);
            return MessageResponse.ok(RESET_REQUESTED_MESSAGE);
        }
        Account saved = pending.account();
        String rawToken = pending.token();
        log.info("Password reset token issued for account {}.", saved.getId());

        sendOrFail(() -> emailService.sendPasswordResetEmail(saved.getEmail(), saved.getName(), rawToken),
                "Failed to send reset email", saved);
        return MessageResponse.ok(RESET_REQUESTED_MESSAGE);
    }

    @Override
    @Transactional
    public MessageResponse resetPassword(String token, String newPassword) {
        if (token == null || token.isBlank()) {
            throw new ValidationException(INVALID_RESET_TOKEN_MESSAGE);
        }

        Account account = accountRepository.findByValidResetToken(token)
                .orElseThrow(() -> {
                    log.warn("Password reset failed: token unknown or expired.");
                    return new ValidationException(INVALID_RESET_TOKEN_MESSAGE);
                });

        requireStrongPassword(newPassword);
        account.setPasswordHash(credentialHasher.hash(newPassword));
        account.clearResetToken();
        accountRepository.save(account);
        log.info("Password reset completed for account {}.", account.getId());

        return MessageResponse.ok("Password reset successfully");
    }

    @Override
    @Transactional(readOnly = true)
    public AuthResponse refreshToken(String refreshToken) {
        TokenClaims claims = jwtService.verifyPurpose(refreshToken, TokenPurpose.REFRESH)
                .orElseThrow(() -> new AuthenticationFailedException(INVALID_REFRESH_TOKEN_MESSAGE));

        Account account = findBySubject(claims.subject())
                .filter(Account::isActive)
                .orElseThrow(() -> {
                    log.warn("Token refresh rejected: account {} missing or inactive.", claims.subject());
                    return new AuthenticationFailedException("User not found or inactive");
                });

        return new AuthResponse(
                "Token refreshed successfully",
                AccountResponse.from(account),
                jwtService.issueAccess(account.getId().toString(), account.getEmail(), account.getName()),
                null,
                AuthResponse.TOKEN_TYPE,
                jwtService.accessTokenTtl().toSeconds());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> resolveCurrentUser(String accessToken) {
        return jwtService.verifyPurpose(accessToken, TokenPurpose.ACCESS)
                .flatMap(claims -> findBySubject(claims.subject()));
    }

    @Override
    @Transactional
    public AccountResponse setAccountActive(UUID accountId, boolean active) {
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new ValidationException("Account not found"));
        account.setActive(active);
        Account saved = accountRepository.save(account);
        log.info("Account {} is now {}.", saved.getId(), active ? "active" : "disabled");
        return AccountResponse.from(saved);
    }

    // --- Helper Methods ---

    private void requireStrongPassword(String password) {
        PasswordStrength strength = credentialHasher.checkStrength(password);
        if (!strength.ok()) {
            throw new ValidationException(strength.reason());
        }
    }

    private String issueVerificationToken(Account account) {
        String rawToken = credentialHasher.generateSecureToken(tokenProperties.length());
        account.issueVerificationToken(rawToken, Instant.now().plus(tokenProperties.verificationTtl()));
        return rawToken;
    }

    private Optional<Account> findBySubject(String subject) {
        if (subject == null) {
            return Optional.empty();
        }
        try {
            return accountRepository.findById(UUID.fromString(subject));
        } catch (IllegalArgumentException e) {
            log.warn("Token subject is not an account id: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Runs after the commit. The email is the point of the operation, so a failed send is reported to the caller.
     */
    private void sendOrFail(BooleanSupplier send, String failureMessage, Account account) {
        boolean sent;
        try {
            sent = send.getAsBoolean();
        } catch (RuntimeException e) {
            log.error("Error sending email for account {}.", account.getId(), e);
            throw new ValidationException(failureMessage, e);
        }
        if (!sent) {
            log.error("Email transport rejected message for account {}.", account.getId());
            throw new ValidationException(failureMessage);
        }
    }

    private record PendingMail(Account account, String token) {
    }
}
