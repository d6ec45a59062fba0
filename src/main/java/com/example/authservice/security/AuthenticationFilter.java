package com.example.authservice.security;

import com.example.authservice.domain.Account;
import com.example.authservice.exceptions.AuthenticationFailedException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@Component
public class AuthenticationFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(AuthenticationFilter.class);
    private final RequestAuthenticator requestAuthenticator;

    public AuthenticationFilter(RequestAuthenticator requestAuthenticator) {
        this.requestAuthenticator = requestAuthenticator;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (header != null) {
            try {
                Account account = requestAuthenticator.authenticate(header);
                Authentication authentication = new UsernamePasswordAuthenticationToken(
                        account,
                        null, // No credentials needed post-authentication
                        authoritiesFor(account));

                SecurityContextHolder.getContext().setAuthentication(authentication);
                log.debug("Authentication successful for account '{}'. Security context updated.", account.getId());
            } catch (AuthenticationFailedException e) {
                SecurityContextHolder.clearContext();
                AuthEntryPoint.recordRejection(request, e.getReason());
                log.debug("Credential rejected: {}. Security context cleared.", e.getReason());
            }
        }

        // Access control decisions happen later based on SecurityConfig
        filterChain.doFilter(request, response);
    }

    private static List<GrantedAuthority> authoritiesFor(Account account) {
        List<GrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority("ROLE_USER"));
        if (account.isAdmin()) {
            authorities.add(new SimpleGrantedAuthority("ROLE_ADMIN"));
        }
        return authorities;
    }
}
