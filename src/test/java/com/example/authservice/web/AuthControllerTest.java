package com.example.authservice.web;

import com.example.authservice.domain.Account;
import com.example.authservice.exceptions.AuthenticationFailedException;
import com.example.authservice.exceptions.ValidationException;
import com.example.authservice.service.AuthService;
import com.example.authservice.web.dto.AccountResponse;
import com.example.authservice.web.dto.AuthResponse;
import com.example.authservice.web.dto.EmailVerificationResponse;
import com.example.authservice.web.dto.MessageResponse;
import com.example.authservice.web.dto.SigninRequest;
import com.example.authservice.web.dto.SignupRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasKey;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("AuthController / AdminController Web Tests")
class AuthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private AuthService authService;

    private Account account;

    @BeforeEach
    void setUp() {
        account = new Account("alice@example.com", "Alice", "hash");
        ReflectionTestUtils.setField(account, "id", UUID.randomUUID());
        account.markVerified(Instant.now());
    }

    private String asJsonString(final Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    @Nested
    @DisplayName("POST /api/v1/auth/signup")
    class SignupEndpointTests {

        @Test
        @DisplayName("✅ Should return 201 Created with the service message")
        void signup_Success() throws Exception {
            given(authService.signup("alice@example.com", "Alice", "Secret123!"))
                    .willReturn(MessageResponse.ok("User registered successfully. Please check your email for verification."));

            mockMvc.perform(post("/api/v1/auth/signup")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(asJsonString(new SignupRequest("alice@example.com", "Alice", "Secret123!"))))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.message").value(containsString("registered")));
        }

        @Test
        @DisplayName("❌ Should return 400 with field errors for malformed input")
        void signup_InvalidBody() throws Exception {
            mockMvc.perform(post("/api/v1/auth/signup")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(asJsonString(new SignupRequest("not-an-email", "A", "short"))))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.errors", hasKey("email")))
                    .andExpect(jsonPath("$.errors", hasKey("name")))
                    .andExpect(jsonPath("$.errors", hasKey("password")));

            then(authService).should(never()).signup(anyString(), anyString(), anyString());
        }

        @Test
        @DisplayName("❌ Should return 422 when the service rejects the registration")
        void signup_Rejected() throws Exception {
            given(authService.signup(anyString(), anyString(), anyString()))
                    .willThrow(new ValidationException("Email already registered"));

            mockMvc.perform(post("/api/v1/auth/signup")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(asJsonString(new SignupRequest("alice@example.com", "Alice", "Secret123!"))))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
                    .andExpect(jsonPath("$.detail").value("Email already registered"));
        }
    }

    @Nested
    @DisplayName("POST /api/v1/auth/signin and token endpoints")
    class SigninEndpointTests {

        @Test
        @DisplayName("✅ Should return tokens on successful sign-in")
        void signin_Success() throws Exception {
            given(authService.signin("alice@example.com", "Secret123!")).willReturn(new AuthResponse(
                    "Sign in successful", AccountResponse.from(account), "access-jwt", "refresh-jwt", "bearer", 1800));

            mockMvc.perform(post("/api/v1/auth/signin")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(asJsonString(new SigninRequest("alice@example.com", "Secret123!"))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.accessToken").value("access-jwt"))
                    .andExpect(jsonPath("$.refreshToken").value("refresh-jwt"))
                    .andExpect(jsonPath("$.tokenType").value("bearer"))
                    .andExpect(jsonPath("$.expiresIn").value(1800))
                    .andExpect(jsonPath("$.user.email").value("alice@example.com"));
        }

        @Test
        @DisplayName("❌ Should return 401 with WWW-Authenticate on bad credentials")
        void signin_BadCredentials() throws Exception {
            given(authService.signin(anyString(), anyString()))
                    .willThrow(new AuthenticationFailedException("Invalid email or password"));

            mockMvc.perform(post("/api/v1/auth/signin")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(asJsonString(new SigninRequest("alice@example.com", "wrong"))))
                    .andExpect(status().isUnauthorized())
                    .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"))
                    .andExpect(jsonPath("$.detail").value("Invalid email or password"));
        }

        @Test
        @DisplayName("✅ verify-email, forgot-password and refresh-token are public")
        void publicEndpoints() throws Exception {
            given(authService.verifyEmail("tok")).willReturn(
                    new EmailVerificationResponse("Email verified successfully. You are now signed in.", true,
                            "access-jwt", "bearer", 1800));
            given(authService.requestPasswordReset("alice@example.com"))
                    .willReturn(MessageResponse.ok("If an account exists for this email, a password reset link has been sent."));
            given(authService.refreshToken("refresh-jwt")).willReturn(new AuthResponse(
                    "Token refreshed successfully", AccountResponse.from(account), "new-access", null, "bearer", 1800));

            mockMvc.perform(post("/api/v1/auth/verify-email")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(asJsonString(Map.of("token", "tok"))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.verified").value(true));
            mockMvc.perform(post("/api/v1/auth/forgot-password")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(asJsonString(Map.of("email", "alice@example.com"))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true));
            mockMvc.perform(post("/api/v1/auth/refresh-token")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(asJsonString(Map.of("refreshToken", "refresh-jwt"))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.accessToken").value("new-access"))
                    .andExpect(jsonPath("$.refreshToken").doesNotExist());
        }

        @Test
        @DisplayName("❌ Should return 400 for an unreadable body")
        void malformedJson() throws Exception {
            mockMvc.perform(post("/api/v1/auth/signin")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{not json"))
                    .andExpect(status().isBadRequest());
        }
    }

    @Nested
    @DisplayName("GET /api/v1/auth/me")
    class CurrentUserEndpointTests {

        @Test
        @DisplayName("✅ Bearer token resolves the current user")
        void me_Bearer() throws Exception {
            given(authService.resolveCurrentUser("access-jwt")).willReturn(Optional.of(account));

            mockMvc.perform(get("/api/v1/auth/me")
                            .header(HttpHeaders.AUTHORIZATION, "Bearer access-jwt"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.email").value("alice@example.com"))
                    .andExpect(jsonPath("$.verified").value(true));
        }

        @Test
        @DisplayName("❌ Missing header returns 401 ProblemDetail")
        void me_NoHeader() throws Exception {
            mockMvc.perform(get("/api/v1/auth/me"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"))
                    .andExpect(jsonPath("$.title").value("Unauthorized"));
        }

        @Test
        @DisplayName("❌ Invalid token returns 401")
        void me_InvalidToken() throws Exception {
            given(authService.resolveCurrentUser("bad")).willReturn(Optional.empty());

            mockMvc.perform(get("/api/v1/auth/me")
                            .header(HttpHeaders.AUTHORIZATION, "Bearer bad"))
                    .andExpect(status().isUnauthorized());
        }

        @Test
        @DisplayName("❌ Disabled account returns 401 even with a valid token")
        void me_Disabled() throws Exception {
            account.setActive(false);
            given(authService.resolveCurrentUser("access-jwt")).willReturn(Optional.of(account));

            mockMvc.perform(get("/api/v1/auth/me")
                            .header(HttpHeaders.AUTHORIZATION, "Bearer access-jwt"))
                    .andExpect(status().isUnauthorized());
        }

        @Test
        @DisplayName("✅ Health is public")
        void health() throws Exception {
            mockMvc.perform(get("/api/v1/auth/health"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("healthy"));
        }
    }

    @Nested
    @DisplayName("POST /api/v1/admin/accounts/{id}/disable")
    class AdminEndpointTests {

        @Test
        @DisplayName("✅ Admin can disable an account")
        void disable_AsAdmin() throws Exception {
            account.setAdmin(true);
            UUID target = UUID.randomUUID();
            Account disabled = new Account("bob@example.com", "Bob", "hash");
            ReflectionTestUtils.setField(disabled, "id", target);
            disabled.setActive(false);
            given(authService.resolveCurrentUser("admin-jwt")).willReturn(Optional.of(account));
            given(authService.setAccountActive(target, false)).willReturn(AccountResponse.from(disabled));

            mockMvc.perform(post("/api/v1/admin/accounts/{id}/disable", target)
                            .header(HttpHeaders.AUTHORIZATION, "Bearer admin-jwt"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.active").value(false));
        }

        @Test
        @DisplayName("❌ Non-admin gets 403")
        void disable_AsUser() throws Exception {
            given(authService.resolveCurrentUser("user-jwt")).willReturn(Optional.of(account));

            mockMvc.perform(post("/api/v1/admin/accounts/{id}/disable", UUID.randomUUID())
                            .header(HttpHeaders.AUTHORIZATION, "Bearer user-jwt"))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.detail").value("Admin privileges required"));

            then(authService).should(never()).setAccountActive(any(UUID.class), anyBoolean());
        }

        @Test
        @DisplayName("❌ Anonymous caller gets 401")
        void disable_Anonymous() throws Exception {
            mockMvc.perform(post("/api/v1/admin/accounts/{id}/enable", UUID.randomUUID()))
                    .andExpect(status().isUnauthorized());

            then(authService).should(never()).setAccountActive(any(UUID.class), eq(true));
        }
    }
}
