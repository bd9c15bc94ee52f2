package com.agrilink.community.api.controller;

import com.agrilink.community.api.dto.UpdateProfileRequest;
import com.agrilink.community.api.dto.UserResponse;
import com.agrilink.community.security.SecurityUtils;
import com.agrilink.community.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST controller for the caller's own profile.
 *
 * @author AgriLink Team
 */
@RestController
@RequestMapping("/api/user")
@PreAuthorize("isAuthenticated()")
@Tag(name = "Profile", description = "The authenticated user's profile")
@SecurityRequirement(name = "bearerAuth")
public class UserController {

    private final AuthService authService;

    public UserController(AuthService authService) {
        this.authService = authService;
    }

    @GetMapping("/profile")
    @Operation(summary = "Get the caller's profile")
    public ResponseEntity<UserResponse> getProfile() {
        return ResponseEntity.ok(authService.getProfile(SecurityUtils.requireCurrentUser()));
    }

    /**
     * Update the profile. Absent fields are left unchanged.
     */
    @PatchMapping
    @Operation(summary = "Update the caller's profile")
    public ResponseEntity<UserResponse> updateProfile(@Valid @RequestBody UpdateProfileRequest request) {
        return ResponseEntity.ok(authService.updateProfile(SecurityUtils.requireCurrentUser(), request));
    }

    /**
     * Replace the profile picture; the previous file is deleted.
     */
    @PostMapping(value = "/image", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload a new profile picture")
    public ResponseEntity<UserResponse> updateImage(@RequestParam("image") MultipartFile image) {
        return ResponseEntity.ok(authService.updateImage(SecurityUtils.requireCurrentUser(), image));
    }
}
