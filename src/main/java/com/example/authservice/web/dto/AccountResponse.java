package com.example.authservice.web.dto;

import com.example.authservice.domain.Account;

import java.time.Instant;
import java.util.UUID;

/**
 * Public view of an account. Never includes the password hash or pending tokens.
 */
public record AccountResponse(
        UUID id,
        String email,
        String name,
        boolean verified,
        boolean active,
        boolean admin,
        Instant createdAt,
        Instant lastLoginAt
) {
    public static AccountResponse from(Account account) {
        return new AccountResponse(
                account.getId(),
                account.getEmail(),
                account.getName(),
                account.isVerified(),
                account.isActive(),
                account.isAdmin(),
                account.getCreatedAt(),
                account.getLastLoginAt()
        );
    }
}
