package com.example.authservice.exceptions;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.core.MethodParameter;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.*;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.context.request.WebRequest;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("GlobalExceptionHandler Tests")
@MockitoSettings(strictness = Strictness.LENIENT)
class GlobalExceptionHandlerTest {

    @InjectMocks
    private GlobalExceptionHandler globalExceptionHandler;

    @Mock
    private WebRequest webRequest;

    private final String requestUri = "/api/v1/auth/signin";

    @BeforeEach
    void setUp() {
        when(webRequest.getDescription(false)).thenReturn(requestUri);
    }

    private void assertCommonFields(ProblemDetail problemDetail) {
        assertThat(problemDetail.getInstance()).isEqualTo(URI.create(requestUri));
        assertThat(problemDetail.getProperties())
                .containsKey("timestamp")
                .extracting("timestamp").isInstanceOf(Instant.class);
    }

    @Nested
    @DisplayName("Application exceptions")
    class ApplicationExceptionTests {

        @Test
        @DisplayName("ValidationException maps to 422 with its reason")
        void validation() {
            ResponseEntity<ProblemDetail> response = globalExceptionHandler.handleResponseStatusException(
                    new ValidationException("Email already registered"), webRequest);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
            ProblemDetail body = response.getBody();
            assertThat(body).isNotNull();
            assertThat(body.getDetail()).isEqualTo("Email already registered");
            assertThat(body.getTitle()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY.getReasonPhrase());
            assertCommonFields(body);
        }

        @Test
        @DisplayName("AuthenticationFailedException maps to 401 with WWW-Authenticate")
        void authenticationFailed() {
            ResponseEntity<ProblemDetail> response = globalExceptionHandler.handleResponseStatusException(
                    new AuthenticationFailedException("Invalid email or password"), webRequest);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
            assertThat(response.getHeaders().getFirst(HttpHeaders.WWW_AUTHENTICATE)).isEqualTo("Bearer");
            assertThat(response.getBody()).isNotNull();
            assertThat(response.getBody().getDetail()).isEqualTo("Invalid email or password");
        }

        @Test
        @DisplayName("AuthorizationException maps to 403")
        void authorization() {
            ResponseEntity<ProblemDetail> response = globalExceptionHandler.handleResponseStatusException(
                    new AuthorizationException("Admin privileges required"), webRequest);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
            assertThat(response.getHeaders().containsKey(HttpHeaders.WWW_AUTHENTICATE)).isFalse();
        }

        @Test
        @DisplayName("Unique-key collision maps to 409 without internals")
        void dataIntegrity() {
            ProblemDetail problemDetail = globalExceptionHandler.handleDataIntegrityViolation(
                    new DataIntegrityViolationException("Unique index or primary key violation: ACCOUNTS(EMAIL)"),
                    webRequest);

            assertThat(problemDetail.getStatus()).isEqualTo(HttpStatus.CONFLICT.value());
            assertThat(problemDetail.getDetail()).doesNotContain("ACCOUNTS");
            assertCommonFields(problemDetail);
        }
    }

    @Nested
    @DisplayName("Spring Security exceptions")
    class SecurityExceptionTests {

        @Test
        @DisplayName("AccessDeniedException maps to 403")
        void accessDenied() {
            ProblemDetail problemDetail = globalExceptionHandler.handleAccessDeniedException(
                    new AccessDeniedException("Permission denied"), webRequest);

            assertThat(problemDetail.getStatus()).isEqualTo(HttpStatus.FORBIDDEN.value());
            assertCommonFields(problemDetail);
        }

        @Test
        @DisplayName("AuthenticationException maps to 401 with a generic message")
        void authentication() {
            ResponseEntity<ProblemDetail> response = globalExceptionHandler.handleAuthenticationException(
                    new BadCredentialsException("Bad credentials for alice"), webRequest);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
            assertThat(response.getHeaders().getFirst(HttpHeaders.WWW_AUTHENTICATE)).isEqualTo("Bearer");
            assertThat(response.getBody()).isNotNull();
            assertThat(response.getBody().getDetail()).doesNotContain("alice");
        }
    }

    @Nested
    @DisplayName("Validation and fallback")
    class ValidationAndFallbackTests {

        @Test
        @DisplayName("Invalid request body maps to 400 with an errors map")
        void methodArgumentNotValid() {
            BindingResult bindingResult = mock(BindingResult.class);
            when(bindingResult.getAllErrors()).thenReturn(List.of(
                    new FieldError("signupRequest", "email", "Email must be a well-formed email address"),
                    new FieldError("signupRequest", "name", "Name cannot be blank")));
            MethodArgumentNotValidException ex =
                    new MethodArgumentNotValidException(mock(MethodParameter.class), bindingResult);

            ResponseEntity<Object> response = globalExceptionHandler.handleMethodArgumentNotValid(
                    ex, new HttpHeaders(), HttpStatus.BAD_REQUEST, webRequest);

            assertThat(response).isNotNull();
            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            ProblemDetail body = (ProblemDetail) response.getBody();
            assertThat(body).isNotNull();
            assertThat(body.getProperties()).isNotNull();
            @SuppressWarnings("unchecked")
            Map<String, String> errors = (Map<String, String>) body.getProperties().get("errors");
            assertThat(errors)
                    .containsEntry("email", "Email must be a well-formed email address")
                    .containsEntry("name", "Name cannot be blank");
        }

        @Test
        @DisplayName("Unexpected exception maps to a generic 500")
        void generic() {
            ProblemDetail problemDetail = globalExceptionHandler.handleGenericException(
                    new IllegalStateException("connection pool exhausted"), webRequest);

            assertThat(problemDetail.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR.value());
            assertThat(problemDetail.getDetail()).doesNotContain("connection pool");
            assertCommonFields(problemDetail);
        }
    }
}
