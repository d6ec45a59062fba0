package com.example.authservice.security;

import com.example.authservice.domain.Account;
import com.example.authservice.domain.EmailNormalizer;
import com.example.authservice.exceptions.AuthenticationFailedException;
import com.example.authservice.exceptions.AuthorizationException;
import com.example.authservice.repository.AccountRepository;
import com.example.authservice.service.AuthService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;

/**
 * Resolves an {@code Authorization} header value to an active, verified account.
 * Accepts {@code Bearer <access-token>} and {@code Basic <base64(email:password)>}.
 */
@Component
public class RequestAuthenticator {
    private static final Logger log = LoggerFactory.getLogger(RequestAuthenticator.class);

    static final String BEARER_SCHEME = "bearer";
    static final String BASIC_SCHEME = "basic";
    static final String INVALID_CREDENTIALS_MESSAGE = "Invalid authentication credentials";

    private final AuthService authService;
    private final AccountRepository accountRepository;
    private final CredentialHasher credentialHasher;

    public RequestAuthenticator(AuthService authService,
                                AccountRepository accountRepository,
                                CredentialHasher credentialHasher) {
        this.authService = authService;
        this.accountRepository = accountRepository;
        this.credentialHasher = credentialHasher;
    }

    /**
     * @param authorizationHeader raw header value, may be null
     * @return the authenticated account
     * @throws AuthenticationFailedException if the credential is missing, malformed or rejected,
     *                                       or the account is disabled or unverified
     */
    @Transactional(readOnly = true)
    public Account authenticate(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            throw new AuthenticationFailedException("Authentication required");
        }

        String header = authorizationHeader.trim();
        int space = header.indexOf(' ');
        if (space <= 0) {
            throw new AuthenticationFailedException(INVALID_CREDENTIALS_MESSAGE);
        }
        String scheme = header.substring(0, space).toLowerCase(Locale.ROOT);
        String credential = header.substring(space + 1).trim();
        if (credential.isEmpty()) {
            throw new AuthenticationFailedException(INVALID_CREDENTIALS_MESSAGE);
        }

        Account account = switch (scheme) {
            case BEARER_SCHEME -> authenticateBearer(credential);
            case BASIC_SCHEME -> authenticateBasic(credential);
            default -> throw new AuthenticationFailedException(INVALID_CREDENTIALS_MESSAGE);
        };

        // Applied whichever scheme located the account.
        if (!account.isActive()) {
            log.warn("Request rejected: account {} is disabled.", account.getId());
            throw new AuthenticationFailedException("User account is disabled");
        }
        if (!account.isVerified()) {
            log.warn("Request rejected: account {} is not verified.", account.getId());
            throw new AuthenticationFailedException("Email not verified");
        }
        return account;
    }

    public void requireAdmin(Account account) {
        if (account == null || !account.isAdmin()) {
            throw new AuthorizationException("Admin privileges required");
        }
    }

    private Account authenticateBearer(String token) {
        return authService.resolveCurrentUser(token)
                .orElseThrow(() -> new AuthenticationFailedException(INVALID_CREDENTIALS_MESSAGE));
    }

    private Account authenticateBasic(String encoded) {
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("Basic credential is not valid Base64.");
            throw new AuthenticationFailedException(INVALID_CREDENTIALS_MESSAGE);
        }

        int separator = decoded.indexOf(':');
        if (separator <= 0) {
            throw new AuthenticationFailedException(INVALID_CREDENTIALS_MESSAGE);
        }
        String email = EmailNormalizer.normalize(decoded.substring(0, separator));
        String password = decoded.substring(separator + 1);

        Account account = accountRepository.findByEmail(email).orElse(null);
        boolean passwordMatches = account != null
                ? credentialHasher.verify(password, account.getPasswordHash())
                : credentialHasher.verifyUnknownAccount(password);
        if (!passwordMatches) {
            log.warn("Basic authentication rejected for email '{}'.", email);
            throw new AuthenticationFailedException("Invalid email or password");
        }
        return account;
    }
}
