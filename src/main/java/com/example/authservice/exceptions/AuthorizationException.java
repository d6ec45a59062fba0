package com.example.authservice.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class AuthorizationException extends ResponseStatusException {

    public AuthorizationException(String reason) {
        super(HttpStatus.FORBIDDEN, reason);
    }
}
