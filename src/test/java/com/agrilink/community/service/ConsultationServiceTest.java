package com.agrilink.community.service;

import com.agrilink.community.api.dto.ConsultationResponse;
import com.agrilink.community.api.dto.CreateConsultationRequest;
import com.agrilink.community.domain.model.Consultation;
import com.agrilink.community.domain.model.Consultation.ConsultationStatus;
import com.agrilink.community.domain.model.User;
import com.agrilink.community.domain.model.User.Role;
import com.agrilink.community.exception.FieldValidationException;
import com.agrilink.community.exception.InvalidStateTransitionException;
import com.agrilink.community.exception.ResourceNotFoundException;
import com.agrilink.community.infrastructure.messaging.KafkaProducerService;
import com.agrilink.community.infrastructure.messaging.events.ConsultationEvent;
import com.agrilink.community.infrastructure.metrics.CloudWatchMetricsService;
import com.agrilink.community.repository.ConsultationRepository;
import com.agrilink.community.repository.UserRepository;
import com.agrilink.community.security.AuthenticatedUser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.access.AccessDeniedException;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import static com.agrilink.community.testutil.TestDataBuilder.actor;
import static com.agrilink.community.testutil.TestDataBuilder.consultation;
import static com.agrilink.community.testutil.TestDataBuilder.user;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ConsultationService.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ConsultationService Unit Tests")
class ConsultationServiceTest {

    @Mock
    private ConsultationRepository consultationRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private UserDirectory userDirectory;

    @Mock
    private KafkaProducerService kafkaProducerService;

    @Mock
    private CloudWatchMetricsService metricsService;

    @InjectMocks
    private ConsultationService consultationService;

    private final AuthenticatedUser farmer = actor(1L, Role.FARMER);
    private final AuthenticatedUser expert = actor(3L, Role.EXPERT);

    private static CreateConsultationRequest booking(Long expertId, Instant when) {
        return new CreateConsultationRequest(expertId, when, "Maize leaves are turning yellow");
    }

    // ========================================
    // bookConsultation() Tests
    // ========================================

    @Test
    @DisplayName("bookConsultation - Success: Creates a pending booking and publishes it")
    void bookConsultation_Success() {
        // Given
        User expertUser = user().id(3L).expert().build();
        when(userRepository.findById(3L)).thenReturn(Optional.of(expertUser));
        when(consultationRepository.save(any(Consultation.class))).thenAnswer(invocation -> {
            Consultation saved = invocation.getArgument(0);
            saved.setId(200L);
            return saved;
        });

        // When
        ConsultationResponse result = consultationService.bookConsultation(farmer,
                booking(3L, Instant.now().plus(2, ChronoUnit.DAYS)));

        // Then
        assertThat(result.getId()).isEqualTo(200L);
        assertThat(result.getStatus()).isEqualTo("pending");
        assertThat(result.getFarmerId()).isEqualTo(1L);
        verify(kafkaProducerService).publishConsultationEvent(any(ConsultationEvent.class));
    }

    @Test
    @DisplayName("bookConsultation - Failure: Booking a non-expert is a field error on expert_id")
    void bookConsultation_NotAnExpert() {
        // Given
        when(userRepository.findById(5L)).thenReturn(Optional.of(user().id(5L).build()));

        // When / Then
        assertThatThrownBy(() -> consultationService.bookConsultation(farmer,
                booking(5L, Instant.now().plus(1, ChronoUnit.DAYS))))
                .isInstanceOf(FieldValidationException.class)
                .satisfies(e -> assertThat(((FieldValidationException) e).getFieldErrors()).containsKey("expert_id"));
        verify(consultationRepository, never()).save(any());
    }

    @Test
    @DisplayName("bookConsultation - Failure: Past date is a field error on consultation_date")
    void bookConsultation_PastDate() {
        // Given
        when(userRepository.findById(3L)).thenReturn(Optional.of(user().id(3L).expert().build()));

        // When / Then
        assertThatThrownBy(() -> consultationService.bookConsultation(farmer,
                booking(3L, Instant.now().minus(1, ChronoUnit.HOURS))))
                .isInstanceOf(FieldValidationException.class)
                .satisfies(e -> assertThat(((FieldValidationException) e).getFieldErrors()).containsKey("consultation_date"));
    }

    @Test
    @DisplayName("bookConsultation - Failure: An expert cannot book themselves")
    void bookConsultation_Self() {
        // Given
        when(userRepository.findById(3L)).thenReturn(Optional.of(user().id(3L).expert().build()));

        // When / Then
        assertThatThrownBy(() -> consultationService.bookConsultation(expert,
                booking(3L, Instant.now().plus(1, ChronoUnit.DAYS))))
                .isInstanceOf(FieldValidationException.class);
    }

    // ========================================
    // Status transition Tests
    // ========================================

    @Test
    @DisplayName("accept - Success: Booked expert accepts with notes")
    void accept_Success() {
        // Given
        Consultation pending = consultation().id(200L).farmerId(1L).expertId(3L).build();
        when(consultationRepository.findById(200L)).thenReturn(Optional.of(pending));
        when(consultationRepository.save(any(Consultation.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        ConsultationResponse result = consultationService.accept(expert, 200L, "Bring soil samples");

        // Then
        assertThat(result.getStatus()).isEqualTo("accepted");
        assertThat(result.getExpertNotes()).isEqualTo("Bring soil samples");
        verify(metricsService).recordConsultationTransition("accepted");
    }

    @Test
    @DisplayName("accept - Failure: The farmer cannot accept their own booking")
    void accept_ByFarmer() {
        // Given
        when(consultationRepository.findById(200L)).thenReturn(Optional.of(consultation().id(200L).build()));

        // When / Then
        assertThatThrownBy(() -> consultationService.accept(farmer, 200L, null))
                .isInstanceOf(AccessDeniedException.class);
        verify(consultationRepository, never()).save(any());
    }

    @Test
    @DisplayName("complete - Failure: A pending booking cannot be completed")
    void complete_FromPending() {
        // Given
        when(consultationRepository.findById(200L)).thenReturn(Optional.of(consultation().id(200L).build()));

        // When / Then
        assertThatThrownBy(() -> consultationService.complete(expert, 200L))
                .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    @DisplayName("cancel - Success: The farmer may cancel an accepted booking")
    void cancel_ByFarmer() {
        // Given
        Consultation accepted = consultation().id(200L).accepted().build();
        when(consultationRepository.findById(200L)).thenReturn(Optional.of(accepted));
        when(consultationRepository.save(any(Consultation.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        ConsultationResponse result = consultationService.cancel(farmer, 200L);

        // Then
        assertThat(result.getStatus()).isEqualTo("cancelled");
        assertThat(accepted.getStatus()).isEqualTo(ConsultationStatus.CANCELLED);
    }

    @Test
    @DisplayName("cancel - Failure: Outsiders cannot cancel")
    void cancel_ByOutsider() {
        // Given
        when(consultationRepository.findById(200L)).thenReturn(Optional.of(consultation().id(200L).build()));

        // When / Then
        assertThatThrownBy(() -> consultationService.cancel(actor(8L, Role.FARMER), 200L))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    @DisplayName("decline - Failure: Missing consultation is not found")
    void decline_NotFound() {
        // Given
        when(consultationRepository.findById(404L)).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> consultationService.decline(expert, 404L, "Busy"))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
