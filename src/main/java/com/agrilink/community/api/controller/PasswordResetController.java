package com.agrilink.community.api.controller;

import com.agrilink.community.api.dto.ApiMessage;
import com.agrilink.community.api.dto.PasswordResetConfirmRequest;
import com.agrilink.community.api.dto.PasswordResetRequest;
import com.agrilink.community.service.PasswordResetService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the one-time-code password reset flow.
 *
 * @author AgriLink Team
 */
@RestController
@RequestMapping("/api/password")
@Tag(name = "Password reset", description = "Reset a forgotten password with an e-mailed code")
public class PasswordResetController {

    static final String REQUEST_ACCEPTED = "If the email exists, a reset code has been sent.";

    private final PasswordResetService passwordResetService;

    public PasswordResetController(PasswordResetService passwordResetService) {
        this.passwordResetService = passwordResetService;
    }

    /**
     * Send a reset code. The answer is the same whether or not the account exists.
     */
    @PostMapping("/request-reset")
    @Operation(summary = "Request a password reset code")
    public ResponseEntity<ApiMessage> requestReset(@Valid @RequestBody PasswordResetRequest request) {
        passwordResetService.requestReset(request.getEmail());
        return ResponseEntity.ok(new ApiMessage(REQUEST_ACCEPTED));
    }

    @PostMapping("/reset")
    @Operation(summary = "Set a new password using a reset code")
    public ResponseEntity<ApiMessage> reset(@Valid @RequestBody PasswordResetConfirmRequest request) {
        passwordResetService.resetPassword(request);
        return ResponseEntity.ok(new ApiMessage("Password has been reset successfully."));
    }
}
