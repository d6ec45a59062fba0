package com.example.authservice.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

@DisplayName("Account Domain Tests")
class AccountTest {

    @Test
    @DisplayName("New account is active, unverified and not admin")
    void constructorDefaults() {
        Account account = new Account("alice@example.com", "Alice", "hash");

        assertThat(account.getId()).isNull();
        assertThat(account.isActive()).isTrue();
        assertThat(account.isVerified()).isFalse();
        assertThat(account.isAdmin()).isFalse();
        assertThat(account.isVerificationPending()).isFalse();
        assertThat(account.isResetPending()).isFalse();
    }

    @Test
    @DisplayName("Verification clears the pending token pair and records the login")
    void markVerified() {
        Account account = new Account("alice@example.com", "Alice", "hash");
        account.issueVerificationToken("token", Instant.now().plusSeconds(60));
        assertThat(account.isVerificationPending()).isTrue();

        Instant at = Instant.now();
        account.markVerified(at);

        assertThat(account.isVerified()).isTrue();
        assertThat(account.getVerificationToken()).isNull();
        assertThat(account.getVerificationTokenExpiry()).isNull();
        assertThat(account.getLastLoginAt()).isEqualTo(at);
    }

    @Test
    @DisplayName("Reset token is set and cleared as a pair")
    void resetToken() {
        Account account = new Account("alice@example.com", "Alice", "hash");
        Instant expiry = Instant.now().plusSeconds(3600);

        account.issueResetToken("reset", expiry);
        assertThat(account.getResetToken()).isEqualTo("reset");
        assertThat(account.getResetTokenExpiry()).isEqualTo(expiry);

        account.clearResetToken();
        assertThat(account.getResetToken()).isNull();
        assertThat(account.getResetTokenExpiry()).isNull();
    }

    @Test
    @DisplayName("Token without expiry is refused")
    void tokenRequiresExpiry() {
        Account account = new Account("alice@example.com", "Alice", "hash");

        assertThatIllegalArgumentException().isThrownBy(() -> account.issueVerificationToken("token", null));
        assertThatIllegalArgumentException().isThrownBy(() -> account.issueResetToken(null, Instant.now()));
    }

    @Test
    @DisplayName("Email normalization trims and lower-cases")
    void normalizeEmail() {
        assertThat(EmailNormalizer.normalize("  Alice@Example.COM ")).isEqualTo("alice@example.com");
        assertThat(EmailNormalizer.normalize(null)).isNull();
    }
}
