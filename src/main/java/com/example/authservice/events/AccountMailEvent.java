package com.example.authservice.events;

import org.springframework.context.ApplicationEvent;

import java.util.UUID;

/**
 * Published when an account change needs a best-effort notification once it is committed.
 */
public class AccountMailEvent extends ApplicationEvent {

    public enum Kind {
        VERIFICATION,
        WELCOME
    }

    private final Kind kind;
    private final UUID accountId;
    private final String email;
    private final String name;
    private final String token;

    /**
     * @param source    the publishing component, usually {@code this}
     * @param kind      which mail to send
     * @param accountId id of the changed account
     * @param email     recipient address
     * @param name      recipient display name
     * @param token     verification token for {@link Kind#VERIFICATION}; ignored for {@link Kind#WELCOME}
     */
    public AccountMailEvent(Object source, Kind kind, UUID accountId, String email, String name, String token) {
        super(source);
        if (kind == null || accountId == null || email == null) {
            throw new IllegalArgumentException("Event details (kind, accountId, email) cannot be null");
        }
        if (kind == Kind.VERIFICATION && token == null) {
            throw new IllegalArgumentException("Verification mail requires a token");
        }
        this.kind = kind;
        this.accountId = accountId;
        this.email = email;
        this.name = name;
        this.token = token;
    }

    public static AccountMailEvent verification(Object source, UUID accountId, String email, String name, String token) {
        return new AccountMailEvent(source, Kind.VERIFICATION, accountId, email, name, token);
    }

    public static AccountMailEvent welcome(Object source, UUID accountId, String email, String name) {
        return new AccountMailEvent(source, Kind.WELCOME, accountId, email, name, null);
    }

    public Kind getKind() {
        return kind;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public String getEmail() {
        return email;
    }

    public String getName() {
        return name;
    }

    public String getToken() {
        return token;
    }
}
