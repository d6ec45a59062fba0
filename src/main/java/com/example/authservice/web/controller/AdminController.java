package com.example.authservice.web.controller;

import com.example.authservice.domain.Account;
import com.example.authservice.security.RequestAuthenticator;
import com.example.authservice.service.AuthService;
import com.example.authservice.web.dto.AccountResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin/accounts")
public class AdminController {
    private static final Logger log = LoggerFactory.getLogger(AdminController.class);
    private final AuthService authService;
    private final RequestAuthenticator requestAuthenticator;

    public AdminController(AuthService authService, RequestAuthenticator requestAuthenticator) {
        this.authService = authService;
        this.requestAuthenticator = requestAuthenticator;
    }

    @PostMapping("/{id}/disable")
    public ResponseEntity<AccountResponse> disable(@PathVariable("id") UUID id,
                                                   @AuthenticationPrincipal Account admin) {
        requestAuthenticator.requireAdmin(admin);
        log.info("Admin {} disabling account {}", admin.getId(), id);
        return ResponseEntity.ok(authService.setAccountActive(id, false));
    }

    @PostMapping("/{id}/enable")
    public ResponseEntity<AccountResponse> enable(@PathVariable("id") UUID id,
                                                  @AuthenticationPrincipal Account admin) {
        requestAuthenticator.requireAdmin(admin);
        log.info("Admin {} enabling account {}", admin.getId(), id);
        return ResponseEntity.ok(authService.setAccountActive(id, true));
    }
}
