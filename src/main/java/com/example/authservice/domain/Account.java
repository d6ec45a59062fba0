package com.example.authservice.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "accounts")
public class Account {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(nullable = false, updatable = false)
    private UUID id;

    @NotBlank(message = "Email cannot be blank")
    @Email(message = "Email must be a well-formed email address")
    @Column(nullable = false, unique = true)
    private String email;

    @NotBlank(message = "Name cannot be blank")
    @Size(max = 255)
    @Column(nullable = false)
    private String name;

    @NotBlank(message = "Password hash cannot be blank")
    @Column(nullable = false)
    private String passwordHash;

    @Column(nullable = false)
    private boolean verified = false;

    @Column(nullable = false)
    private boolean active = true;

    @Column(nullable = false)
    private boolean admin = false;

    @Column(unique = true)
    private String verificationToken;

    @Column
    private Instant verificationTokenExpiry;

    @Column(unique = true)
    private String resetToken;

    @Column
    private Instant resetTokenExpiry;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Column
    private Instant lastLoginAt;

    // --- Constructors ---
    protected Account() {
    }

    public Account(String email, String name, String passwordHash) {
        this.email = email;
        this.name = name;
        this.passwordHash = passwordHash;
        this.verified = false;
        this.active = true;
        this.admin = false;
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // --- Pending-token transitions (token and expiry always change together) ---

    public void issueVerificationToken(String token, Instant expiry) {
        if (token == null || expiry == null) {
            throw new IllegalArgumentException("Verification token and expiry must both be set");
        }
        this.verificationToken = token;
        this.verificationTokenExpiry = expiry;
    }

    /**
     * Marks the email as verified and drops the pending verification token.
     */
    public void markVerified(Instant at) {
        this.verified = true;
        this.verificationToken = null;
        this.verificationTokenExpiry = null;
        this.lastLoginAt = at;
    }

    public void issueResetToken(String token, Instant expiry) {
        if (token == null || expiry == null) {
            throw new IllegalArgumentException("Reset token and expiry must both be set");
        }
        this.resetToken = token;
        this.resetTokenExpiry = expiry;
    }

    public void clearResetToken() {
        this.resetToken = null;
        this.resetTokenExpiry = null;
    }

    public boolean isVerificationPending() {
        return verificationToken != null;
    }

    public boolean isResetPending() {
        return resetToken != null;
    }

    public UUID getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public boolean isVerified() {
        return verified;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isAdmin() {
        return admin;
    }

    public void setAdmin(boolean admin) {
        this.admin = admin;
    }

    public String getVerificationToken() {
        return verificationToken;
    }

    public Instant getVerificationTokenExpiry() {
        return verificationTokenExpiry;
    }

    public String getResetToken() {
        return resetToken;
    }

    public Instant getResetTokenExpiry() {
        return resetTokenExpiry;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getLastLoginAt() {
        return lastLoginAt;
    }

    public void setLastLoginAt(Instant lastLoginAt) {
        this.lastLoginAt = lastLoginAt;
    }

    @Override
    public String toString() {
        return "Account{id=" + id + ", email='" + email + "', verified=" + verified + ", active=" + active + "}";
    }
}
