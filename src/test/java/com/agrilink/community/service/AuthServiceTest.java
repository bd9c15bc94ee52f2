package com.agrilink.community.service;

import com.agrilink.community.api.dto.AuthResponse;
import com.agrilink.community.api.dto.LoginRequest;
import com.agrilink.community.api.dto.RegisterRequest;
import com.agrilink.community.api.dto.UpdateProfileRequest;
import com.agrilink.community.api.dto.UserResponse;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Optional;

import static com.agrilink.community.testutil.TestDataBuilder.actor;
import static com.agrilink.community.testutil.TestDataBuilder.user;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AuthService.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AuthService Unit Tests")
class AuthServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    @Mock
    private JwtTokenProvider tokenProvider;

    @Mock
    private TokenRevocationService revocationService;

    @Mock
    private FileStorageService fileStorageService;

    @Mock
    private CloudWatchMetricsService metricsService;

    private AuthService authService;

    @BeforeEach
    void setUp() {
        authService = new AuthService(userRepository, passwordEncoder, tokenProvider, revocationService,
                fileStorageService, metricsService, false);
    }

    private static RegisterRequest registration(String email, String role) {
        RegisterRequest request = new RegisterRequest();
        request.setName(" Jane Wanjiru ");
        request.setEmail(email);
        request.setPassword("secret123");
        request.setRole(role);
        return request;
    }

    // ========================================
    // register() Tests
    // ========================================

    @Test
    @DisplayName("register - Success: Stores a hashed password and returns a bearer token")
    void register_Success() {
        // Given
        when(userRepository.existsByEmailIgnoreCase("jane@example.com")).thenReturn(false);
        when(passwordEncoder.encode("secret123")).thenReturn("hashed");
        when(userRepository.save(any(User.class))).thenAnswer(invocation -> {
            User saved = invocation.getArgument(0);
            saved.setId(11L);
            return saved;
        });
        when(tokenProvider.generateToken(any(User.class))).thenReturn("jwt-token");
        when(tokenProvider.getExpirationSeconds()).thenReturn(3600L);

        // When
        AuthResponse response = authService.register(registration(" Jane@Example.com ", "farmer"));

        // Then
        assertThat(response.getToken()).isEqualTo("jwt-token");
        assertThat(response.getTokenType()).isEqualTo("Bearer");
        assertThat(response.getExpiresIn()).isEqualTo(3600L);

        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(captor.capture());
        assertThat(captor.getValue().getEmail()).isEqualTo("jane@example.com");
        assertThat(captor.getValue().getName()).isEqualTo("Jane Wanjiru");
        assertThat(captor.getValue().getPassword()).isEqualTo("hashed");
        assertThat(captor.getValue().getRole()).isEqualTo(Role.FARMER);
    }

    @Test
    @DisplayName("register - Failure: Duplicate e-mail is a conflict")
    void register_DuplicateEmail() {
        // Given
        when(userRepository.existsByEmailIgnoreCase("jane@example.com")).thenReturn(true);

        // When / Then
        assertThatThrownBy(() -> authService.register(registration("jane@example.com", "farmer")))
                .isInstanceOf(DuplicateResourceException.class);
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("register - Failure: Admin self-registration is refused when disabled")
    void register_AdminRefused() {
        // Given
        when(userRepository.existsByEmailIgnoreCase("boss@example.com")).thenReturn(false);

        // When / Then
        assertThatThrownBy(() -> authService.register(registration("boss@example.com", "admin")))
                .isInstanceOf(AccessDeniedException.class);
        verify(userRepository, never()).save(any());
    }

    // ========================================
    // login() / logout() Tests
    // ========================================

    @Test
    @DisplayName("login - Success: Matching password issues a token")
    void login_Success() {
        // Given
        User user = user().id(5L).email("jane@example.com").build();
        when(userRepository.findByEmailIgnoreCase("jane@example.com")).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("secret123", user.getPassword())).thenReturn(true);
        when(tokenProvider.generateToken(user)).thenReturn("jwt-token");

        // When
        AuthResponse response = authService.login(new LoginRequest("jane@example.com", "secret123"));

        // Then
        assertThat(response.getToken()).isEqualTo("jwt-token");
        assertThat(response.getUser().getId()).isEqualTo(5L);
        verify(metricsService).recordLogin(true);
    }

    @Test
    @DisplayName("login - Failure: Wrong password is rejected")
    void login_WrongPassword() {
        // Given
        User user = user().id(5L).email("jane@example.com").build();
        when(userRepository.findByEmailIgnoreCase("jane@example.com")).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("nope", user.getPassword())).thenReturn(false);

        // When / Then
        assertThatThrownBy(() -> authService.login(new LoginRequest("jane@example.com", "nope")))
                .isInstanceOf(AuthenticationFailedException.class);
        verify(metricsService).recordLogin(false);
        verify(tokenProvider, never()).generateToken(any());
    }

    @Test
    @DisplayName("login - Failure: Unknown e-mail is rejected the same way")
    void login_UnknownEmail() {
        // Given
        when(userRepository.findByEmailIgnoreCase("ghost@example.com")).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> authService.login(new LoginRequest("ghost@example.com", "secret123")))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("Invalid credentials");
    }

    @Test
    @DisplayName("logout - Revokes the token until its expiry")
    void logout_RevokesToken() {
        // Given
        AuthenticatedUser actor = actor(5L, Role.FARMER);
        when(revocationService.revoke(actor.getTokenId(), actor.getTokenExpiresAt())).thenReturn(true);

        // When
        authService.logout(actor);

        // Then
        verify(revocationService).revoke(actor.getTokenId(), actor.getTokenExpiresAt());
    }

    // ========================================
    // updateProfile() Tests
    // ========================================

    @Test
    @DisplayName("updateProfile - Failure: Non-admin cannot grant the admin role")
    void updateProfile_AdminRoleRefused() {
        // Given
        when(userRepository.findById(5L)).thenReturn(Optional.of(user().id(5L).build()));
        UpdateProfileRequest request = new UpdateProfileRequest();
        request.setRole("admin");

        // When / Then
        assertThatThrownBy(() -> authService.updateProfile(actor(5L, Role.FARMER), request))
                .isInstanceOf(AccessDeniedException.class);
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("updateProfile - Success: Only present fields change")
    void updateProfile_PartialUpdate() {
        // Given
        User user = user().id(5L).name("Old Name").build();
        user.setLocation("Nakuru");
        when(userRepository.findById(5L)).thenReturn(Optional.of(user));
        when(userRepository.save(user)).thenReturn(user);
        UpdateProfileRequest request = new UpdateProfileRequest();
        request.setName("New Name");
        request.setRole("expert");

        // When
        UserResponse response = authService.updateProfile(actor(5L, Role.FARMER), request);

        // Then
        assertThat(response.getName()).isEqualTo("New Name");
        assertThat(user.getLocation()).isEqualTo("Nakuru");
        assertThat(user.getRole()).isEqualTo(Role.EXPERT);
    }

    // ========================================
    // updateImage() Tests
    // ========================================

    private static final MockMultipartFile NEW_IMAGE =
            new MockMultipartFile("image", "me.png", "image/png", new byte[]{1, 2, 3});

    @Test
    @DisplayName("updateImage - Success: Previous upload stored by the service is deleted")
    void updateImage_DeletesPreviousUpload() {
        // Given
        User user = user().id(5L).build();
        user.setImageUrl("userImage/old.png");
        user.setImageStored(true);
        when(userRepository.findById(5L)).thenReturn(Optional.of(user));
        when(userRepository.save(user)).thenReturn(user);
        when(fileStorageService.store(eq(NEW_IMAGE), eq(StorageFolder.USER_IMAGES), eq(UploadPolicy.IMAGE)))
                .thenReturn(new StoredFile("userImage/new.png", "me.png", "image/png", 3));

        // When
        UserResponse response = authService.updateImage(actor(5L, Role.FARMER), NEW_IMAGE);

        // Then
        assertThat(response.getImageUrl()).isEqualTo("userImage/new.png");
        assertThat(user.getImageStored()).isTrue();
        verify(fileStorageService).delete("userImage/old.png");
    }

    @Test
    @DisplayName("updateImage - Registration-supplied path is never deleted, even under userImage/")
    void updateImage_KeepsUnownedPath() {
        // Given: the path came from the registration form, not from an upload
        User user = user().id(5L).build();
        user.setImageUrl("userImage/../productImages/someone-else.jpg");
        when(userRepository.findById(5L)).thenReturn(Optional.of(user));
        when(userRepository.save(user)).thenReturn(user);
        when(fileStorageService.store(any(), any(), any()))
                .thenReturn(new StoredFile("userImage/new.png", "me.png", "image/png", 3));

        // When
        authService.updateImage(actor(5L, Role.FARMER), NEW_IMAGE);

        // Then
        verify(fileStorageService, never()).delete(anyString());
        assertThat(user.getImageStored()).isTrue();
    }

    @Test
    @DisplayName("updateImage - Stored flag with a traversal path still deletes nothing")
    void updateImage_TraversalPathNotDeleted() {
        // Given
        User user = user().id(5L).build();
        user.setImageUrl("userImage/../productImages/someone-else.jpg");
        user.setImageStored(true);
        when(userRepository.findById(5L)).thenReturn(Optional.of(user));
        when(userRepository.save(user)).thenReturn(user);
        when(fileStorageService.store(any(), any(), any()))
                .thenReturn(new StoredFile("userImage/new.png", "me.png", "image/png", 3));

        // When
        authService.updateImage(actor(5L, Role.FARMER), NEW_IMAGE);

        // Then
        verify(fileStorageService, never()).delete(anyString());
    }
}
