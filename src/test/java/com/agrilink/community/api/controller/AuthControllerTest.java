package com.agrilink.community.api.controller;

import com.agrilink.community.api.dto.AuthResponse;
import com.agrilink.community.api.dto.LoginRequest;
import com.agrilink.community.api.dto.RegisterRequest;
import com.agrilink.community.api.dto.UserResponse;
import com.agrilink.community.api.dto.UserSummary;
import com.agrilink.community.api.exception.GlobalExceptionHandler;
import com.agrilink.community.domain.model.User.Role;
import com.agrilink.community.exception.AuthenticationFailedException;
import com.agrilink.community.exception.DuplicateResourceException;
import com.agrilink.community.infrastructure.metrics.CloudWatchMetricsService;
import com.agrilink.community.security.AuthenticatedUser;
import com.agrilink.community.service.AuthService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static com.agrilink.community.testutil.TestDataBuilder.authenticateAs;
import static com.agrilink.community.testutil.TestDataBuilder.user;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for AuthController using MockMvc.
 */
@WebMvcTest(AuthController.class)
@AutoConfigureMockMvc(addFilters = false)
@ContextConfiguration(classes = {AuthController.class, GlobalExceptionHandler.class})
@DisplayName("AuthController Tests")
class AuthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AuthService authService;

    @MockBean
    private CloudWatchMetricsService metricsService;

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    private static final String REGISTRATION = """
            {
                "name": "Jane Wanjiru",
                "email": "jane@example.com",
                "password": "secret123",
                "phone_number": "+254700000000",
                "role": "farmer"
            }
            """;

    // ========================================
    // POST /api/register Tests
    // ========================================

    @Test
    @DisplayName("POST /register - Valid request returns 201 with a bearer token")
    void register_Returns201() throws Exception {
        // Given
        UserResponse user = UserResponse.fromEntity(user().id(11L).email("jane@example.com").build());
        when(authService.register(any(RegisterRequest.class)))
                .thenReturn(new AuthResponse(user, "jwt-token", "Bearer", 86400));

        // When / Then
        mockMvc.perform(post("/api/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REGISTRATION))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.token").value("jwt-token"))
                .andExpect(jsonPath("$.token_type").value("Bearer"))
                .andExpect(jsonPath("$.expires_in").value(86400))
                .andExpect(jsonPath("$.user.role").value("farmer"));
    }

    @Test
    @DisplayName("POST /register - Invalid role and short password return 422")
    void register_Invalid_Returns422() throws Exception {
        // Given
        String requestBody = """
                {
                    "name": "Jane",
                    "email": "not-an-email",
                    "password": "123",
                    "role": "wizard"
                }
                """;

        // When / Then
        mockMvc.perform(post("/api/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.details.fieldErrors.email").exists())
                .andExpect(jsonPath("$.details.fieldErrors.password").exists())
                .andExpect(jsonPath("$.details.fieldErrors.role").exists());

        verifyNoInteractions(authService);
    }

    @Test
    @DisplayName("POST /register - Relative image path returns 422")
    void register_RelativeImagePath_Returns422() throws Exception {
        // Given
        String requestBody = """
                {
                    "name": "Jane",
                    "email": "jane@example.com",
                    "password": "secret123",
                    "role": "farmer",
                    "image_url": "userImage/../productImages/tomatoes.jpg"
                }
                """;

        // When / Then
        mockMvc.perform(post("/api/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.details.fieldErrors.image_url").exists());

        verifyNoInteractions(authService);
    }

    @Test
    @DisplayName("POST /register - Taken e-mail returns 409")
    void register_Duplicate_Returns409() throws Exception {
        // Given
        when(authService.register(any())).thenThrow(
                new DuplicateResourceException("email", "The email has already been taken."));

        // When / Then
        mockMvc.perform(post("/api/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REGISTRATION))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("POST /register - Admin self-registration returns 403")
    void register_Admin_Returns403() throws Exception {
        // Given
        when(authService.register(any())).thenThrow(
                new AccessDeniedException("Administrator accounts cannot be self-registered"));

        // When / Then
        mockMvc.perform(post("/api/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REGISTRATION.replace("farmer", "admin")))
                .andExpect(status().isForbidden());
    }

    // ========================================
    // POST /api/login and /api/logout Tests
    // ========================================

    @Test
    @DisplayName("POST /login - Bad credentials return 401")
    void login_BadCredentials_Returns401() throws Exception {
        // Given
        when(authService.login(any(LoginRequest.class)))
                .thenThrow(new AuthenticationFailedException("Invalid credentials"));

        // When / Then
        mockMvc.perform(post("/api/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\": \"jane@example.com\", \"password\": \"wrong-pass\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid credentials"));
    }

    @Test
    @DisplayName("POST /logout - Revokes the caller's token")
    void logout_Returns200() throws Exception {
        // Given
        AuthenticatedUser actor = authenticateAs(11L, Role.FARMER);

        // When / Then
        mockMvc.perform(post("/api/logout"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Logged out successfully"));

        verify(authService).logout(actor);
    }

    @Test
    @DisplayName("GET /experts - Lists expert summaries")
    void listExperts_Returns200() throws Exception {
        // Given
        when(authService.listExperts()).thenReturn(List.of(
                UserSummary.fromEntity(user().id(3L).name("Dr. Otieno").expert().build())));

        // When / Then
        mockMvc.perform(get("/api/experts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].role").value("expert"));
    }
}
