package com.agrilink.community.api.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial profile update. Absent fields are left unchanged.
 *
 * @author AgriLink Team
 */
@Data
@NoArgsConstructor
public class UpdateProfileRequest {

    @Size(min = 1, max = 255, message = "Name must be between 1 and 255 characters")
    private String name;

    @Size(max = 255, message = "Username must not exceed 255 characters")
    private String username;

    @Size(max = 20, message = "Phone number must not exceed 20 characters")
    private String phoneNumber;

    @Size(max = 255, message = "Location must not exceed 255 characters")
    private String location;

    @Pattern(regexp = "(?i)admin|expert|customer|farmer", message = "Role must be one of admin, expert, customer, farmer")
    private String role;

    /**
     * Replaces the whole favorites list when present.
     */
    private List<Long> favorites;
}
