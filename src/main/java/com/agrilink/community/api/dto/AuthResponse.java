package com.agrilink.community.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for register and login.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuthResponse {

    private UserResponse user;
    private String token;
    private String tokenType;
    private long expiresIn;
}
