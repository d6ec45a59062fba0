package com.example.authservice.service.impl;

import com.example.authservice.config.AuthProperties;
import com.example.authservice.service.EmailService;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.io.UnsupportedEncodingException;

@Service
public class EmailServiceImpl implements EmailService {

    private static final Logger log = LoggerFactory.getLogger(EmailServiceImpl.class);

    private final JavaMailSender mailSender;
    private final AuthProperties.Mail mailProperties;

    public EmailServiceImpl(JavaMailSender mailSender, AuthProperties properties) {
        this.mailSender = mailSender;
        this.mailProperties = properties.mail();
    }

    @Override
    public boolean sendVerificationEmail(String email, String name, String token) {
        String verificationUrl = mailProperties.baseUrl() + "/verify-email?token=" + token;
        String subject = "Verify your email - " + mailProperties.fromName();
        String body = "<html><body>" +
                "<h2>Welcome, " + HtmlUtils.htmlEscape(name) + "!</h2>" +
                "<p>Thank you for signing up. Please verify your email address to complete your registration:</p>" +
                "<p><a href=\"" + verificationUrl + "\">Verify Email Address</a></p>" +
                "<p>This link will expire in 24 hours.</p>" +
                "<p>If you didn't create an account, please ignore this email.</p>" +
                "</body></html>";
        return send(email, subject, body, "verification");
    }

    @Override
    public boolean sendPasswordResetEmail(String email, String name, String token) {
        String resetUrl = mailProperties.baseUrl() + "/reset-password?token=" + token;
        String subject = "Reset your password - " + mailProperties.fromName();
        String body = "<html><body>" +
                "<h2>Password Reset Request</h2>" +
                "<p>Hi " + HtmlUtils.htmlEscape(name) + ",</p>" +
                "<p>We received a request to reset your password. Click the link below to choose a new one:</p>" +
                "<p><a href=\"" + resetUrl + "\">Reset Password</a></p>" +
                "<p>This link will expire in 1 hour.</p>" +
                "<p>If you didn't request a password reset, please ignore this email.</p>" +
                "</body></html>";
        return send(email, subject, body, "password reset");
    }

    @Override
    public boolean sendWelcomeEmail(String email, String name) {
        String subject = "Welcome to " + mailProperties.fromName() + "!";
        String body = "<html><body>" +
                "<h2>Your account is now active!</h2>" +
                "<p>Hi " + HtmlUtils.htmlEscape(name) + ",</p>" +
                "<p>Your email has been verified and you can now sign in.</p>" +
                "<p><a href=\"" + mailProperties.baseUrl() + "\">Open the app</a></p>" +
                "</body></html>";
        return send(email, subject, body, "welcome");
    }

    private boolean send(String to, String subject, String htmlBody, String kind) {
        MimeMessage message = mailSender.createMimeMessage();
        MimeMessageHelper helper = new MimeMessageHelper(message, "utf-8");

        try {
            helper.setTo(to);
            helper.setSubject(subject);
            helper.setText(htmlBody, true); // true indicates HTML content
            helper.setFrom(mailProperties.fromAddress(), mailProperties.fromName());

            mailSender.send(message);
            log.info("{} email sent successfully to {}", kind, to);
            return true;

        } catch (MessagingException | MailException | UnsupportedEncodingException e) {
            log.error("Failed to send {} email to {}: {}", kind, to, e.getMessage(), e);
            return false;
        }
    }
}
