package com.example.authservice.service;

/**
 * Outbound account notifications. Every method reports whether the message was handed
 * to the mail transport; callers decide whether a {@code false} is fatal.
 */
public interface EmailService {

    /**
     * Sends the link that confirms ownership of {@code email}.
     *
     * @param email recipient address
     * @param name  display name used in the greeting
     * @param token raw verification token placed in the link
     * @return true if the message was accepted by the transport
     */
    boolean sendVerificationEmail(String email, String name, String token);

    /**
     * Sends the link used to choose a new password. The link is valid for one hour.
     */
    boolean sendPasswordResetEmail(String email, String name, String token);

    boolean sendWelcomeEmail(String email, String name);
}
