package com.example.authservice.listeners;

import com.example.authservice.events.AccountMailEvent;
import com.example.authservice.service.EmailService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class AccountMailListener {

    private static final Logger log = LoggerFactory.getLogger(AccountMailListener.class);

    private final EmailService emailService;

    public AccountMailListener(EmailService emailService) {
        this.emailService = emailService;
    }

    /**
     * Sends the mail once the account change is visible to other transactions.
     * The change stands whatever happens here, so failures are only logged.
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleAccountMail(AccountMailEvent event) {
        try {
            boolean sent = switch (event.getKind()) {
                case VERIFICATION -> emailService.sendVerificationEmail(event.getEmail(), event.getName(), event.getToken());
                case WELCOME -> emailService.sendWelcomeEmail(event.getEmail(), event.getName());
            };
            if (sent) {
                log.debug("Sent {} email for account {}.", event.getKind(), event.getAccountId());
            } else {
                log.warn("Could not send {} email for account {}.", event.getKind(), event.getAccountId());
            }
        } catch (Exception e) {
            log.error("Error sending {} email for account {}: {}",
                    event.getKind(), event.getAccountId(), e.getMessage(), e);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_ROLLBACK)
    public void handleAccountMailRollback(AccountMailEvent event) {
        log.warn("Transaction rolled back for account {}. No {} email sent.", event.getAccountId(), event.getKind());
    }
}
