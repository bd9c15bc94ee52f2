package com.agrilink.community.service;

import com.agrilink.community.api.dto.AuthResponse;
import com.agrilink.community.api.dto.LoginRequest;
import com.agrilink.community.api.dto.RegisterRequest;
import com.agrilink.community.api.dto.UpdateProfileRequest;
import com.agrilink.community.api.dto.UserResponse;
import com.agrilink.community.api.dto.UserSummary;
import com.agrilink.community.domain.model.User;
import com.agrilink.community.domain.model.User.Role;
import com.agrilink.community.exception.AuthenticationFailedException;
import com.agrilink.community.exception.DuplicateResourceException;
import com.agrilink.community.infrastructure.cache.TokenRevocationService;
import com.agrilink.community.infrastructure.metrics.CloudWatchMetricsService;
import com.agrilink.community.infrastructure.storage.FileStorageService;
import com.agrilink.community.infrastructure.storage.StorageFolder;
import com.agrilink.community.infrastructure.storage.StoredFile;
import com.agrilink.community.infrastructure.storage.UploadPolicy;
import com.agrilink.community.repository.UserRepository;
import com.agrilink.community.security.AuthenticatedUser;
import com.agrilink.community.security.JwtTokenProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Service for accounts: registration, login, logout and the caller's own profile.
 *
 * @author AgriLink Team
 */
@Service
public class AuthService {

    private static final Logger logger = LoggerFactory.getLogger(AuthService.class);

    static final String TOKEN_TYPE = "Bearer";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider tokenProvider;
    private final TokenRevocationService revocationService;
    private final FileStorageService fileStorageService;
    private final CloudWatchMetricsService metricsService;
    private final boolean allowAdminRegistration;

    public AuthService(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenProvider tokenProvider,
            TokenRevocationService revocationService,
            FileStorageService fileStorageService,
            CloudWatchMetricsService metricsService,
            @Value("${agrilink.auth.allow-admin-registration:false}") boolean allowAdminRegistration
    ) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.tokenProvider = tokenProvider;
        this.revocationService = revocationService;
        this.fileStorageService = fileStorageService;
        this.metricsService = metricsService;
        this.allowAdminRegistration = allowAdminRegistration;
    }

    /**
     * Create an account and sign it in.
     *
     * @param request Registration data
     * @return The new user and a bearer token
     * @throws DuplicateResourceException if the e-mail is already registered
     * @throws AccessDeniedException if admin self-registration is disabled
     */
    @Transactional
    public AuthResponse register(RegisterRequest request) {
        String email = request.getEmail().trim().toLowerCase(Locale.ROOT);
        if (userRepository.existsByEmailIgnoreCase(email)) {
            logger.warn("Registration rejected, e-mail already taken: {}", email);
            throw new DuplicateResourceException("email", "The email has already been taken.");
        }

        Role role = Role.fromValue(request.getRole());
        if (role == Role.ADMIN && !allowAdminRegistration) {
            logger.warn("Registration as admin rejected for {}", email);
            throw new AccessDeniedException("Administrator accounts cannot be self-registered");
        }

        User user = User.builder()
                .name(request.getName().trim())
                .username(request.getUsername())
                .email(email)
                .phoneNumber(request.getPhoneNumber())
                .password(passwordEncoder.encode(request.getPassword()))
                .imageUrl(request.getImageUrl())
                .location(request.getLocation())
                .role(role)
                .build();
        user = userRepository.save(user);

        logger.info("Registered user {} with role {}", user.getId(), role);
        return issueToken(user);
    }

    /**
     * Check credentials and issue a token.
     *
     * @throws AuthenticationFailedException on unknown e-mail or wrong password
     */
    @Transactional(readOnly = true)
    public AuthResponse login(LoginRequest request) {
        User user = userRepository.findByEmailIgnoreCase(request.getEmail().trim())
                .filter(candidate -> passwordEncoder.matches(request.getPassword(), candidate.getPassword()))
                .orElse(null);

        if (user == null) {
            metricsService.recordLogin(false);
            logger.warn("Failed login for {}", request.getEmail());
            throw new AuthenticationFailedException("Invalid credentials");
        }

        metricsService.recordLogin(true);
        logger.info("User {} logged in", user.getId());
        return issueToken(user);
    }

    /**
     * Revoke the token the caller authenticated with until it would have expired anyway.
     */
    public void logout(AuthenticatedUser actor) {
        if (actor.getTokenId() == null) {
            logger.warn("Logout without a token id for user {}", actor.getId());
            return;
        }
        boolean revoked = revocationService.revoke(actor.getTokenId(), actor.getTokenExpiresAt());
        logger.info("User {} logged out (token revoked: {})", actor.getId(), revoked);
    }

    @Transactional(readOnly = true)
    public UserResponse getProfile(AuthenticatedUser actor) {
        return UserResponse.fromEntity(loadUser(actor.getId()));
    }

    /**
     * Apply the present fields of a profile update.
     * Only administrators may grant the admin role.
     */
    @Transactional
    public UserResponse updateProfile(AuthenticatedUser actor, UpdateProfileRequest request) {
        User user = loadUser(actor.getId());

        if (request.getName() != null) {
            user.setName(request.getName().trim());
        }
        if (request.getUsername() != null) {
            user.setUsername(request.getUsername());
        }
        if (request.getPhoneNumber() != null) {
            user.setPhoneNumber(request.getPhoneNumber());
        }
        if (request.getLocation() != null) {
            user.setLocation(request.getLocation());
        }
        if (request.getRole() != null) {
            Role role = Role.fromValue(request.getRole());
            if (role == Role.ADMIN && !actor.isAdmin()) {
                throw new AccessDeniedException("Only administrators can grant the admin role");
            }
            if (role != user.getRole()) {
                logger.info("User {} changed role from {} to {}", user.getId(), user.getRole(), role);
            }
            user.setRole(role);
        }
        if (request.getFavorites() != null) {
            user.getFavorites().clear();
            user.getFavorites().addAll(new LinkedHashSet<>(request.getFavorites()));
        }

        user = userRepository.save(user);
        logger.info("Updated profile of user {}", user.getId());
        return UserResponse.fromEntity(user);
    }

    /**
     * Replace the profile image. The previous file is deleted only when this service stored it;
     * a URL given at registration is left alone.
     */
    @Transactional
    public UserResponse updateImage(AuthenticatedUser actor, MultipartFile image) {
        User user = loadUser(actor.getId());

        StoredFile stored = fileStorageService.store(image, StorageFolder.USER_IMAGES, UploadPolicy.IMAGE);
        AfterTransaction.rollback(() -> fileStorageService.delete(stored.relativePath()));
        String previous = user.getImageUrl();
        boolean ownsPrevious = Boolean.TRUE.equals(user.getImageStored()) && isStoredPath(previous);
        user.setImageUrl(stored.relativePath());
        user.setImageStored(true);
        user = userRepository.save(user);

        if (ownsPrevious) {
            AfterTransaction.commit(() -> fileStorageService.delete(previous));
        }

        logger.info("Updated profile image of user {}", user.getId());
        return UserResponse.fromEntity(user);
    }

    @Transactional(readOnly = true)
    public List<UserSummary> listExperts() {
        return userRepository.findByRoleOrderByNameAsc(Role.EXPERT).stream()
                .map(UserSummary::fromEntity)
                .collect(Collectors.toList());
    }

    private AuthResponse issueToken(User user) {
        String token = tokenProvider.generateToken(user);
        return new AuthResponse(UserResponse.fromEntity(user), token, TOKEN_TYPE, tokenProvider.getExpirationSeconds());
    }

    private User loadUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new AuthenticationFailedException("User no longer exists"));
    }

    /**
     * Registration may carry an external image URL; only files we stored are ours to delete.
     */
    private static boolean isStoredPath(String path) {
        return path != null
                && path.startsWith(StorageFolder.USER_IMAGES.getDirectory() + "/")
                && !path.contains("..");
    }
}
