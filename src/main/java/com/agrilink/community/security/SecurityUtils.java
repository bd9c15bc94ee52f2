package com.agrilink.community.security;

import com.agrilink.community.exception.AuthenticationFailedException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Optional;

/**
 * Utility class for security and authorization operations.
 * Provides helper methods for checking user permissions and extracting user identity.
 *
 * @author AgriLink Team
 */
public final class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Get the currently authenticated user.
     *
     * @return Principal, or empty for anonymous requests
     */
    public static Optional<AuthenticatedUser> getCurrentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication != null && authentication.isAuthenticated()
                && authentication.getPrincipal() instanceof AuthenticatedUser) {
            return Optional.of((AuthenticatedUser) authentication.getPrincipal());
        }

        return Optional.empty();
    }

    /**
     * Get the currently authenticated user ID.
     *
     * @return User ID, or null if not authenticated
     */
    public static Long getCurrentUserId() {
        return getCurrentUser().map(AuthenticatedUser::getId).orElse(null);
    }

    /**
     * Get the currently authenticated user or fail with 401.
     *
     * @return Principal
     * @throws AuthenticationFailedException if the request is anonymous
     */
    public static AuthenticatedUser requireCurrentUser() {
        return getCurrentUser()
                .orElseThrow(() -> new AuthenticationFailedException("Authentication required"));
    }

    public static boolean isAdmin() {
        return getCurrentUser().map(AuthenticatedUser::isAdmin).orElse(false);
    }

    /**
     * Verify that the acting user owns a resource or is an admin.
     *
     * @param actor Acting user
     * @param ownerId Owner of the resource
     * @param action Description used in the error message (e.g. "update this product")
     * @throws AccessDeniedException if access is denied
     */
    public static void verifyOwnerOrAdmin(AuthenticatedUser actor, Long ownerId, String action) {
        if (actor.isAdmin() || actor.is(ownerId)) {
            return;
        }
        throw new AccessDeniedException("You are not allowed to " + action);
    }

    /**
     * Verify that the acting user is an admin.
     *
     * @throws AccessDeniedException if access is denied
     */
    public static void verifyAdmin(AuthenticatedUser actor) {
        if (!actor.isAdmin()) {
            throw new AccessDeniedException("Access denied: Admin role required");
        }
    }
}
