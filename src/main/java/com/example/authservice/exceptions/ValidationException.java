package com.example.authservice.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Rejected input: policy violations, unknown or expired single-use tokens, duplicate registration.
 * The reason is shown to the caller verbatim.
 */
public class ValidationException extends ResponseStatusException {

    public ValidationException(String reason) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, reason);
    }

    public ValidationException(String reason, Throwable cause) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, reason, cause);
    }
}
