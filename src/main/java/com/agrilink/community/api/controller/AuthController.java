package com.agrilink.community.api.controller;

import com.agrilink.community.api.dto.ApiMessage;
import com.agrilink.community.api.dto.AuthResponse;
import com.agrilink.community.api.dto.LoginRequest;
import com.agrilink.community.api.dto.RegisterRequest;
import com.agrilink.community.api.dto.UserSummary;
import com.agrilink.community.security.SecurityUtils;
import com.agrilink.community.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for registration, login and logout.
 *
 * @author AgriLink Team
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Auth", description = "Registration, login and logout")
public class AuthController {

    private static final Logger logger = LoggerFactory.getLogger(AuthController.class);

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    /**
     * Create an account and sign it in.
     *
     * @param request Registration details
     * @return The new user and a bearer token
     */
    @PostMapping("/register")
    @Operation(summary = "Register a new account")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        logger.debug("Registration request for {}", request.getEmail());
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    /**
     * Exchange credentials for a bearer token.
     */
    @PostMapping("/login")
    @Operation(summary = "Log in with e-mail and password")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    /**
     * Revoke the token used for this request.
     */
    @PostMapping("/logout")
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Revoke the current token", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<ApiMessage> logout() {
        authService.logout(SecurityUtils.requireCurrentUser());
        return ResponseEntity.ok(new ApiMessage("Logged out successfully"));
    }

    @GetMapping("/experts")
    @Operation(summary = "List experts available for consultations")
    public ResponseEntity<List<UserSummary>> listExperts() {
        return ResponseEntity.ok(authService.listExperts());
    }
}
