package com.example.authservice.exceptions;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Bad credentials, a disabled or unverified account, or an unusable token.
 */
public class AuthenticationFailedException extends ResponseStatusException {

    public AuthenticationFailedException(String reason) {
        super(HttpStatus.UNAUTHORIZED, reason);
    }

    @Override
    public HttpHeaders getHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        return headers;
    }
}
