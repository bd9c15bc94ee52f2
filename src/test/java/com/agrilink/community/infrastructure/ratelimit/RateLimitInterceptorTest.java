package com.agrilink.community.infrastructure.ratelimit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RateLimitInterceptor.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RateLimitInterceptor Unit Tests")
class RateLimitInterceptorTest {

    @Mock
    private RateLimitService rateLimitService;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    private RateLimitInterceptor interceptor;

    @BeforeEach
    void setUp() {
        interceptor = new RateLimitInterceptor(rateLimitService, objectMapper);
    }

    @Test
    @DisplayName("Should pass the request through and report remaining quota")
    void testPreHandle_Allowed() throws Exception {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/login");
        request.setRemoteAddr("192.168.1.5");
        MockHttpServletResponse response = new MockHttpServletResponse();
        when(rateLimitService.checkRateLimit("auth", "192.168.1.5"))
                .thenReturn(RateLimitResult.permit(10, 7));

        // When
        boolean proceed = interceptor.preHandle(request, response, new Object());

        // Then
        assertThat(proceed).isTrue();
        assertThat(response.getHeader("X-RateLimit-Limit")).isEqualTo("10");
        assertThat(response.getHeader("X-RateLimit-Remaining")).isEqualTo("7");
        assertThat(response.getHeader("Retry-After")).isNull();
    }

    @Test
    @DisplayName("Should answer 429 with a JSON error once the window is exhausted")
    void testPreHandle_Rejected() throws Exception {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/password/forgot");
        request.setRemoteAddr("192.168.1.5");
        MockHttpServletResponse response = new MockHttpServletResponse();
        when(rateLimitService.checkRateLimit("auth", "192.168.1.5"))
                .thenReturn(RateLimitResult.deny(10, 42));

        // When
        boolean proceed = interceptor.preHandle(request, response, new Object());

        // Then
        assertThat(proceed).isFalse();
        assertThat(response.getStatus()).isEqualTo(429);
        assertThat(response.getHeader("Retry-After")).isEqualTo("42");
        assertThat(response.getHeader("X-RateLimit-Remaining")).isEqualTo("0");

        JsonNode body = objectMapper.readTree(response.getContentAsByteArray());
        assertThat(body.get("status").asInt()).isEqualTo(429);
        assertThat(body.get("path").asText()).isEqualTo("/api/password/forgot");
        assertThat(body.get("message").asText()).contains("42 seconds");
        assertThat(body.get("details").get("retry_after").asLong()).isEqualTo(42L);
    }

    // ==================== Client address ====================

    @Test
    @DisplayName("Should count spoofed forwarding headers against the real peer address")
    void testPreHandle_IgnoresForwardingHeaders() throws Exception {
        // Given: every request claims a different origin
        when(rateLimitService.checkRateLimit("auth", "10.0.0.3"))
                .thenReturn(RateLimitResult.permit(10, 9), RateLimitResult.deny(10, 30));

        // When
        boolean first = interceptor.preHandle(spoofed("203.0.113.1"), new MockHttpServletResponse(), new Object());
        boolean second = interceptor.preHandle(spoofed("203.0.113.2"), new MockHttpServletResponse(), new Object());

        // Then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        verify(rateLimitService, times(2)).checkRateLimit("auth", "10.0.0.3");
        verifyNoMoreInteractions(rateLimitService);
    }

    private static MockHttpServletRequest spoofed(String claimedOrigin) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/password/reset");
        request.addHeader("X-Forwarded-For", claimedOrigin);
        request.addHeader("X-Real-IP", claimedOrigin);
        request.setRemoteAddr("10.0.0.3");
        return request;
    }
}
