package com.agrilink.community.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Registered community member.
 * The role decides which resources a user may manage: experts publish tips and take consultations,
 * admins moderate everything.
 *
 * @author AgriLink Team
 */
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_users_email", columnList = "email", unique = true),
    @Index(name = "idx_users_role", columnList = "role")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "username", length = 255)
    private String username;

    @Column(name = "email", nullable = false, unique = true, length = 255)
    private String email;

    @Column(name = "phone_number", length = 20)
    private String phoneNumber;

    /**
     * BCrypt hash, never the raw password.
     */
    @JsonIgnore
    @Column(name = "password", nullable = false, length = 100)
    private String password;

    /**
     * Relative path of the profile picture (e.g. "userImage/abc.jpg").
     */
    @Column(name = "image_url", length = 500)
    private String imageUrl;

    /**
     * True when {@link #imageUrl} points at an upload this service stored and may delete.
     */
    @JsonIgnore
    @Column(name = "image_stored", nullable = false)
    @Builder.Default
    private Boolean imageStored = false;

    @Column(name = "location", length = 255)
    private String location;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    private Role role;

    /**
     * Product ids the user marked as favorite.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "user_favorites", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "product_id")
    @Builder.Default
    private Set<Long> favorites = new LinkedHashSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
        if (role == null) {
            role = Role.CUSTOMER;
        }
        if (imageStored == null) {
            imageStored = false;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public boolean isExpert() {
        return role == Role.EXPERT;
    }

    /**
     * Community roles.
     */
    public enum Role {
        ADMIN,
        EXPERT,
        FARMER,
        CUSTOMER;

        /**
         * Parse a role name case-insensitively ("expert", "EXPERT").
         *
         * @param value Role name
         * @return Matching role
         * @throws IllegalArgumentException if the name is unknown
         */
        public static Role fromValue(String value) {
            if (value == null) {
                throw new IllegalArgumentException("Role is required");
            }
            return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
