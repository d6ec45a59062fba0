package com.example.authservice.repository;

import com.example.authservice.domain.Account;
import org.springframework.data.repository.CrudRepository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface AccountRepository extends CrudRepository<Account, UUID> {

    Optional<Account> findByEmail(String email);

    Optional<Account> findByVerificationTokenAndVerificationTokenExpiryAfter(String token, Instant now);

    Optional<Account> findByResetTokenAndResetTokenExpiryAfter(String token, Instant now);

    /**
     * Pending verification lookup: token value must match and must not have expired.
     */
    default Optional<Account> findByValidVerificationToken(String token) {
        return findByVerificationTokenAndVerificationTokenExpiryAfter(token, Instant.now());
    }

    default Optional<Account> findByValidResetToken(String token) {
        return findByResetTokenAndResetTokenExpiryAfter(token, Instant.now());
    }
}
