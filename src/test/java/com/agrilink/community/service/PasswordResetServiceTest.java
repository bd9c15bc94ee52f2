package com.agrilink.community.service;

import com.agrilink.community.api.dto.PasswordResetConfirmRequest;
import com.agrilink.community.domain.model.PasswordResetOtp;
import com.agrilink.community.domain.model.User;
import com.agrilink.community.exception.FieldValidationException;
import com.agrilink.community.infrastructure.messaging.KafkaProducerService;
import com.agrilink.community.infrastructure.messaging.events.NotificationEvent;
import com.agrilink.community.infrastructure.metrics.CloudWatchMetricsService;
import com.agrilink.community.repository.PasswordResetOtpRepository;
import com.agrilink.community.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

import static com.agrilink.community.testutil.TestDataBuilder.user;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PasswordResetService.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PasswordResetService Unit Tests")
class PasswordResetServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private PasswordResetOtpRepository otpRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    @Mock
    private KafkaProducerService kafkaProducerService;

    @Mock
    private CloudWatchMetricsService metricsService;

    private PasswordResetService resetService;

    @BeforeEach
    void setUp() {
        resetService = new PasswordResetService(userRepository, otpRepository, passwordEncoder,
                kafkaProducerService, metricsService, 6, 10, 3);
    }

    private static PasswordResetConfirmRequest confirm(String otp) {
        PasswordResetConfirmRequest request = new PasswordResetConfirmRequest();
        request.setEmail("jane@example.com");
        request.setOtp(otp);
        request.setPassword("newSecret1");
        request.setPasswordConfirmation("newSecret1");
        return request;
    }

    // ========================================
    // requestReset() Tests
    // ========================================

    @Test
    @DisplayName("requestReset - Unknown e-mail does nothing and raises nothing")
    void requestReset_UnknownEmail() {
        // Given
        when(userRepository.findByEmailIgnoreCase("ghost@example.com")).thenReturn(Optional.empty());

        // When
        resetService.requestReset("ghost@example.com");

        // Then
        verifyNoInteractions(otpRepository, kafkaProducerService);
    }

    @Test
    @DisplayName("requestReset - Success: Invalidates earlier codes, stores a new one and notifies")
    void requestReset_Success() {
        // Given
        User user = user().id(5L).email("jane@example.com").build();
        when(userRepository.findByEmailIgnoreCase("jane@example.com")).thenReturn(Optional.of(user));
        when(otpRepository.invalidateUnusedForUser(5L)).thenReturn(1);

        // When
        Instant before = Instant.now();
        resetService.requestReset(" jane@example.com ");

        // Then
        ArgumentCaptor<PasswordResetOtp> otp = ArgumentCaptor.forClass(PasswordResetOtp.class);
        verify(otpRepository).save(otp.capture());
        assertThat(otp.getValue().getUserId()).isEqualTo(5L);
        assertThat(otp.getValue().getOtp()).matches("\\d{6}");
        assertThat(otp.getValue().getExpiresAt())
                .isBetween(before.plus(10, ChronoUnit.MINUTES), Instant.now().plus(10, ChronoUnit.MINUTES));

        ArgumentCaptor<NotificationEvent> event = ArgumentCaptor.forClass(NotificationEvent.class);
        verify(kafkaProducerService).publishNotification(event.capture());
        assertThat(event.getValue().getRecipientEmail()).isEqualTo("jane@example.com");
        assertThat(event.getValue().getAttributes()).containsEntry("otp", otp.getValue().getOtp());
        verify(metricsService).recordPasswordResetRequested();
    }

    @Test
    @DisplayName("generateOtp - Always zero-padded to the configured length")
    void generateOtp_Length() {
        for (int i = 0; i < 200; i++) {
            assertThat(resetService.generateOtp()).hasSize(6).containsOnlyDigits();
        }
    }

    // ========================================
    // resetPassword() Tests
    // ========================================

    @Test
    @DisplayName("resetPassword - Success: Marks the code used and stores the new hash")
    void resetPassword_Success() {
        // Given
        User user = user().id(5L).email("jane@example.com").build();
        PasswordResetOtp otp = PasswordResetOtp.builder()
                .userId(5L)
                .otp("123456")
                .expiresAt(Instant.now().plus(5, ChronoUnit.MINUTES))
                .build();
        when(userRepository.findByEmailIgnoreCase("jane@example.com")).thenReturn(Optional.of(user));
        when(otpRepository.findFirstByUserIdAndUsedFalseOrderByCreatedAtDesc(5L))
                .thenReturn(Optional.of(otp));
        when(passwordEncoder.encode("newSecret1")).thenReturn("new-hash");

        // When
        resetService.resetPassword(confirm("123456"));

        // Then
        assertThat(otp.getUsed()).isTrue();
        assertThat(user.getPassword()).isEqualTo("new-hash");
        verify(userRepository).save(user);
    }

    @Test
    @DisplayName("resetPassword - Failure: Expired code is an otp field error")
    void resetPassword_Expired() {
        // Given
        User user = user().id(5L).email("jane@example.com").build();
        PasswordResetOtp otp = PasswordResetOtp.builder()
                .userId(5L)
                .otp("123456")
                .expiresAt(Instant.now().minus(1, ChronoUnit.MINUTES))
                .build();
        when(userRepository.findByEmailIgnoreCase("jane@example.com")).thenReturn(Optional.of(user));
        when(otpRepository.findFirstByUserIdAndUsedFalseOrderByCreatedAtDesc(5L))
                .thenReturn(Optional.of(otp));

        // When / Then
        assertThatThrownBy(() -> resetService.resetPassword(confirm("123456")))
                .isInstanceOf(FieldValidationException.class)
                .satisfies(e -> assertThat(((FieldValidationException) e).getFieldErrors()).containsKey("otp"));
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("resetPassword - Failure: Unknown e-mail looks like a bad code")
    void resetPassword_UnknownEmail() {
        // Given
        when(userRepository.findByEmailIgnoreCase("jane@example.com")).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> resetService.resetPassword(confirm("123456")))
                .isInstanceOf(FieldValidationException.class);
        verifyNoInteractions(otpRepository);
    }

    @Test
    @DisplayName("resetPassword - Failure: Wrong code is counted and does not change the password")
    void resetPassword_WrongCodeCounted() {
        // Given
        User user = user().id(5L).email("jane@example.com").build();
        PasswordResetOtp otp = PasswordResetOtp.builder()
                .userId(5L)
                .otp("123456")
                .expiresAt(Instant.now().plus(5, ChronoUnit.MINUTES))
                .build();
        when(userRepository.findByEmailIgnoreCase("jane@example.com")).thenReturn(Optional.of(user));
        when(otpRepository.findFirstByUserIdAndUsedFalseOrderByCreatedAtDesc(5L)).thenReturn(Optional.of(otp));

        // When / Then
        assertThatThrownBy(() -> resetService.resetPassword(confirm("000000")))
                .isInstanceOf(FieldValidationException.class);
        assertThat(otp.getFailedAttempts()).isEqualTo(1);
        assertThat(otp.getUsed()).isFalse();
        verify(otpRepository).save(otp);
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("resetPassword - Failure: Code is burnt after the attempt limit, even the right guess fails")
    void resetPassword_BurntAfterLimit() {
        // Given
        User user = user().id(5L).email("jane@example.com").build();
        PasswordResetOtp otp = PasswordResetOtp.builder()
                .userId(5L)
                .otp("123456")
                .expiresAt(Instant.now().plus(5, ChronoUnit.MINUTES))
                .build();
        when(userRepository.findByEmailIgnoreCase("jane@example.com")).thenReturn(Optional.of(user));
        when(otpRepository.findFirstByUserIdAndUsedFalseOrderByCreatedAtDesc(5L)).thenAnswer(
                invocation -> Optional.of(otp).filter(candidate -> !candidate.getUsed()));

        // When: three wrong guesses reach the limit
        for (String guess : List.of("000001", "000002", "000003")) {
            assertThatThrownBy(() -> resetService.resetPassword(confirm(guess)))
                    .isInstanceOf(FieldValidationException.class);
        }

        // Then
        assertThat(otp.getUsed()).isTrue();
        assertThatThrownBy(() -> resetService.resetPassword(confirm("123456")))
                .isInstanceOf(FieldValidationException.class);
        verify(passwordEncoder, never()).encode(anyString());
        verify(userRepository, never()).save(any());
    }
}
