package com.example.authservice.exceptions;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.*;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.net.URI;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders every failure reaching a controller as an RFC 7807 Problem Detail.
 * Application exceptions carry their user-facing message as the {@code ResponseStatusException} reason.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String TIMESTAMP_PROPERTY = "timestamp";
    static final String ERRORS_PROPERTY = "errors"; // For validation errors

    // --- Application Exceptions ---

    /**
     * Covers {@link ValidationException}, {@link AuthenticationFailedException} and {@link AuthorizationException}.
     * Headers of the exception (e.g. {@code WWW-Authenticate} on 401) are copied to the response.
     */
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemDetail> handleResponseStatusException(ResponseStatusException ex, WebRequest request) {
        if (log.isInfoEnabled()) {
            log.info("Handling ResponseStatusException for {}: Status={}, Reason={}",
                    request.getDescription(false), ex.getStatusCode(), ex.getReason());
        }
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(ex.getStatusCode(), ex.getReason());
        problemDetail.setTitle(getReasonPhrase(ex.getStatusCode()));
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return ResponseEntity.status(ex.getStatusCode())
                .headers(ex.getHeaders())
                .body(problemDetail);
    }

    // Two first-time signups for the same email racing on the unique key
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ProblemDetail handleDataIntegrityViolation(DataIntegrityViolationException ex, WebRequest request) {
        log.warn("Data integrity violation for request {}: {}",
                request.getDescription(false), ex.getMostSpecificCause().getMessage());
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(
                HttpStatus.CONFLICT,
                "The request conflicts with a concurrent update. Please try again."
        );
        problemDetail.setTitle(HttpStatus.CONFLICT.getReasonPhrase());
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return problemDetail;
    }

    // --- Spring Security Exceptions ---

    @ExceptionHandler(AccessDeniedException.class)
    public ProblemDetail handleAccessDeniedException(AccessDeniedException ex, WebRequest request) {
        if (log.isWarnEnabled()) {
            log.warn("Access Denied for request {}: {}",
                    request.getDescription(false), ex.getMessage());
        }
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(
                HttpStatus.FORBIDDEN,
                "Access Denied. You do not have sufficient permissions to access this resource."
        );
        problemDetail.setTitle(HttpStatus.FORBIDDEN.getReasonPhrase());
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return problemDetail;
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ProblemDetail> handleAuthenticationException(AuthenticationException ex, WebRequest request) {
        if (log.isWarnEnabled()) {
            log.warn("Authentication failure for request {}: {}",
                    request.getDescription(false), ex.getMessage());
        }
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(
                HttpStatus.UNAUTHORIZED,
                "Invalid authentication credentials"
        );
        problemDetail.setTitle(HttpStatus.UNAUTHORIZED.getReasonPhrase());
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                .body(problemDetail);
    }

    // --- Bean Validation Exceptions ---

    @ExceptionHandler(ConstraintViolationException.class)
    public ProblemDetail handleConstraintViolationException(ConstraintViolationException ex, WebRequest request) {
        if (log.isWarnEnabled()) {
            log.warn("Constraint violation for request {}: {}",
                    request.getDescription(false), ex.getMessage());
        }

        Map<String, String> errors = ex.getConstraintViolations().stream()
                .collect(Collectors.toMap(
                        violation -> getPropertyName(violation.getPropertyPath().toString()),
                        ConstraintViolation::getMessage,
                        (first, second) -> first
                ));

        ProblemDetail problemDetail = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
        problemDetail.setTitle(HttpStatus.BAD_REQUEST.getReasonPhrase());
        problemDetail.setDetail("Input validation failed. Check the 'errors' field for details.");
        problemDetail.setProperty(ERRORS_PROPERTY, errors);
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return problemDetail;
    }

    // --- Overrides from ResponseEntityExceptionHandler ---

    // @Valid on @RequestBody
    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request) {
        if (log.isWarnEnabled()) {
            log.warn("Method argument validation failed for request {}: {} error(s)",
                    request.getDescription(false), ex.getErrorCount());
        }
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.putIfAbsent(fieldName, error.getDefaultMessage());
        });

        ProblemDetail problemDetail = ProblemDetail.forStatus(status);
        problemDetail.setTitle(getReasonPhrase(status, "Validation Failed"));
        problemDetail.setDetail("Request body validation failed. Check the 'errors' field for details.");
        problemDetail.setProperty(ERRORS_PROPERTY, errors);
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());

        return new ResponseEntity<>(problemDetail, headers, status);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request) {
        log.warn("Unreadable request body for {}: {}", request.getDescription(false), ex.getMessage());
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, "Malformed request body");
        problemDetail.setTitle(getReasonPhrase(status, "Bad Request"));
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return new ResponseEntity<>(problemDetail, headers, status);
    }

    // --- Generic Fallback ---

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGenericException(Exception ex, WebRequest request) {
        if (log.isErrorEnabled()) {
            log.error("Unhandled exception caught by @ExceptionHandler(Exception.class) for request {}:",
                    request.getDescription(false), ex);
        }
        // Never expose internals to the client
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected internal error occurred. Please try again later or contact support."
        );
        problemDetail.setTitle(HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase());
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return problemDetail;
    }

    @Override
    protected ResponseEntity<Object> handleExceptionInternal(
            @NonNull Exception ex, @Nullable Object body, @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode statusCode, @NonNull WebRequest request) {

        ProblemDetail problemDetailToReturn;

        if (body instanceof ProblemDetail pdBody) {
            problemDetailToReturn = pdBody;
            Map<String, Object> properties = problemDetailToReturn.getProperties();
            if (properties == null || !properties.containsKey(TIMESTAMP_PROPERTY)) {
                problemDetailToReturn.setProperty(TIMESTAMP_PROPERTY, Instant.now());
            }
            if (problemDetailToReturn.getInstance() == null) {
                problemDetailToReturn.setInstance(URI.create(request.getDescription(false)));
            }
            if (problemDetailToReturn.getTitle() == null) {
                problemDetailToReturn.setTitle(getReasonPhrase(statusCode));
            }
        } else {
            log.warn("Creating basic ProblemDetail in handleExceptionInternal for exception type {}: {}",
                    ex.getClass().getSimpleName(), ex.getMessage());
            problemDetailToReturn = ProblemDetail.forStatus(statusCode);
            problemDetailToReturn.setTitle(getReasonPhrase(statusCode));
            problemDetailToReturn.setDetail(ex.getMessage());
            problemDetailToReturn.setInstance(URI.create(request.getDescription(false)));
            problemDetailToReturn.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        }

        return new ResponseEntity<>(problemDetailToReturn, headers, statusCode);
    }

    // --- Helper Methods ---

    private String getPropertyName(String propertyPath) {
        if (propertyPath == null || propertyPath.isEmpty()) {
            return "unknown";
        }
        int lastDot = propertyPath.lastIndexOf('.');
        int lastBracket = propertyPath.lastIndexOf('[');
        int lastSeparator = Math.max(lastDot, lastBracket);
        return (lastSeparator == -1) ? propertyPath : propertyPath.substring(lastSeparator + 1);
    }

    private String getReasonPhrase(HttpStatusCode statusCode) {
        return getReasonPhrase(statusCode, "Status");
    }

    private String getReasonPhrase(HttpStatusCode statusCode, String fallbackTitle) {
        if (statusCode instanceof HttpStatus httpStatus) {
            return httpStatus.getReasonPhrase();
        }
        return fallbackTitle;
    }
}
