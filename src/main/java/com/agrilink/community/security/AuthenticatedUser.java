package com.agrilink.community.security;

import com.agrilink.community.domain.model.User.Role;

import java.time.Instant;
import java.util.Objects;

/**
 * Principal stored in the security context for a request carrying a valid bearer token.
 *
 * @author AgriLink Team
 */
public final class AuthenticatedUser {

    private final Long id;
    private final String email;
    private final Role role;
    private final String tokenId;
    private final Instant tokenExpiresAt;

    public AuthenticatedUser(Long id, String email, Role role, String tokenId, Instant tokenExpiresAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.email = email;
        this.role = Objects.requireNonNull(role, "role");
        this.tokenId = tokenId;
        this.tokenExpiresAt = tokenExpiresAt;
    }

    /**
     * Principal without token details, for code paths that only need identity and role.
     */
    public static AuthenticatedUser of(Long id, Role role) {
        return new AuthenticatedUser(id, null, role, null, null);
    }

    public Long getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public Role getRole() {
        return role;
    }

    public String getTokenId() {
        return tokenId;
    }

    public Instant getTokenExpiresAt() {
        return tokenExpiresAt;
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public boolean isExpert() {
        return role == Role.EXPERT;
    }

    public boolean is(Long userId) {
        return id.equals(userId);
    }

    @Override
    public String toString() {
        return "AuthenticatedUser{id=" + id + ", role=" + role + "}";
    }
}
