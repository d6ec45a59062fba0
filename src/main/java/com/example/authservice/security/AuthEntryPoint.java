package com.example.authservice.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Renders the 401 for protected routes. When {@link AuthenticationFilter} rejected a presented
 * credential, its reason (bad token, disabled account, unverified email) becomes the detail.
 */
@Component
public class AuthEntryPoint implements AuthenticationEntryPoint {

    static final String REJECTION_REASON_ATTRIBUTE = AuthEntryPoint.class.getName() + ".rejectionReason";
    static final String MISSING_CREDENTIALS_MESSAGE = "Authentication required";

    private static final Logger log = LoggerFactory.getLogger(AuthEntryPoint.class);
    private final ObjectMapper objectMapper;

    public AuthEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    static void recordRejection(HttpServletRequest request, String reason) {
        request.setAttribute(REJECTION_REASON_ATTRIBUTE, reason);
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) {

        String detail = detailFor(request);
        log.warn("Rejected unauthenticated request to {}: {}", request.getRequestURI(), detail);

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);

        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.UNAUTHORIZED, detail);
        problemDetail.setTitle("Unauthorized");
        problemDetail.setInstance(URI.create(request.getRequestURI()));
        problemDetail.setProperty("timestamp", Instant.now());

        try {
            objectMapper.writeValue(response.getWriter(), problemDetail);
        } catch (IOException e) {
            log.error("Failed to write 401 body for {}", request.getRequestURI(), e);
        }
    }

    private static String detailFor(HttpServletRequest request) {
        if (request.getAttribute(REJECTION_REASON_ATTRIBUTE) instanceof String reason && !reason.isBlank()) {
            return reason;
        }
        if (request.getHeader(HttpHeaders.AUTHORIZATION) == null) {
            return MISSING_CREDENTIALS_MESSAGE;
        }
        return RequestAuthenticator.INVALID_CREDENTIALS_MESSAGE;
    }
}
