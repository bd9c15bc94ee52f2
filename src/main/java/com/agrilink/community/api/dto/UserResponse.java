package com.agrilink.community.api.dto;

import com.agrilink.community.domain.model.User;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Response DTO for a user's own profile.
 *
 * @author AgriLink Team
 */
@Data
@NoArgsConstructor
public class UserResponse {

    private Long id;
    private String name;
    private String username;
    private String email;
    private String phoneNumber;
    private String imageUrl;
    private String location;
    private String role;
    private List<Long> favorites;
    private Instant createdAt;
    private Instant updatedAt;

    public static UserResponse fromEntity(User user) {
        UserResponse response = new UserResponse();
        response.setId(user.getId());
        response.setName(user.getName());
        response.setUsername(user.getUsername());
        response.setEmail(user.getEmail());
        response.setPhoneNumber(user.getPhoneNumber());
        response.setImageUrl(user.getImageUrl());
        response.setLocation(user.getLocation());
        response.setRole(user.getRole().name().toLowerCase(Locale.ROOT));
        response.setFavorites(user.getFavorites() == null ? new ArrayList<>() : new ArrayList<>(user.getFavorites()));
        response.setCreatedAt(user.getCreatedAt());
        response.setUpdatedAt(user.getUpdatedAt());
        return response;
    }
}
