package com.agrilink.community.service;

import com.agrilink.community.api.dto.ConsultationResponse;
import com.agrilink.community.api.dto.CreateConsultationRequest;
import com.agrilink.community.api.dto.UserSummary;
import com.agrilink.community.domain.model.Consultation;
import com.agrilink.community.domain.model.Consultation.ConsultationStatus;
import com.agrilink.community.domain.model.User;
import com.agrilink.community.exception.FieldValidationException;
import com.agrilink.community.exception.ResourceNotFoundException;
import com.agrilink.community.infrastructure.messaging.KafkaProducerService;
import com.agrilink.community.infrastructure.messaging.events.ConsultationEvent;
import com.agrilink.community.infrastructure.metrics.CloudWatchMetricsService;
import com.agrilink.community.repository.ConsultationRepository;
import com.agrilink.community.repository.UserRepository;
import com.agrilink.community.security.AuthenticatedUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Service for consultations booked by farmers with experts.
 *
 * <p>The expert accepts, declines or completes a booking; either participant may cancel it
 * while it is pending or accepted.
 *
 * @author AgriLink Team
 */
@Service
public class ConsultationService {

    private static final Logger logger = LoggerFactory.getLogger(ConsultationService.class);

    private final ConsultationRepository consultationRepository;
    private final UserRepository userRepository;
    private final UserDirectory userDirectory;
    private final KafkaProducerService kafkaProducerService;
    private final CloudWatchMetricsService metricsService;

    public ConsultationService(
            ConsultationRepository consultationRepository,
            UserRepository userRepository,
            UserDirectory userDirectory,
            KafkaProducerService kafkaProducerService,
            CloudWatchMetricsService metricsService
    ) {
        this.consultationRepository = consultationRepository;
        this.userRepository = userRepository;
        this.userDirectory = userDirectory;
        this.kafkaProducerService = kafkaProducerService;
        this.metricsService = metricsService;
    }

    /**
     * Book a consultation for the acting user.
     *
     * @throws FieldValidationException if the expert does not exist, is not an expert, or the date is past
     */
    @Transactional
    public ConsultationResponse bookConsultation(AuthenticatedUser actor, CreateConsultationRequest request) {
        User expert = userRepository.findById(request.getExpertId())
                .filter(User::isExpert)
                .orElseThrow(() -> new FieldValidationException("expert_id", "The selected expert id is invalid."));

        if (!request.getConsultationDate().isAfter(Instant.now())) {
            throw new FieldValidationException("consultation_date", "The consultation date must be a date after now.");
        }
        if (expert.getId().equals(actor.getId())) {
            throw new FieldValidationException("expert_id", "You cannot book a consultation with yourself.");
        }

        Consultation consultation = Consultation.builder()
                .farmerId(actor.getId())
                .expertId(expert.getId())
                .consultationDate(request.getConsultationDate())
                .description(request.getDescription())
                .status(ConsultationStatus.PENDING)
                .build();
        consultation = consultationRepository.save(consultation);

        kafkaProducerService.publishConsultationEvent(new ConsultationEvent(
                consultation.getId(), consultation.getFarmerId(), consultation.getExpertId(),
                consultation.getStatus().getValue(), consultation.getConsultationDate(),
                ConsultationEvent.EventType.BOOKED));
        metricsService.recordConsultationTransition(ConsultationStatus.PENDING.getValue());

        logger.info("User {} booked consultation {} with expert {}", actor.getId(), consultation.getId(), expert.getId());
        return toResponse(consultation);
    }

    @Transactional(readOnly = true)
    public List<ConsultationResponse> listFarmerBookings(AuthenticatedUser actor) {
        return toResponses(consultationRepository.findByFarmerIdOrderByCreatedAtDesc(actor.getId()));
    }

    @Transactional(readOnly = true)
    public List<ConsultationResponse> listExpertBookings(AuthenticatedUser actor) {
        return toResponses(consultationRepository.findByExpertIdOrderByCreatedAtDesc(actor.getId()));
    }

    @Transactional
    public ConsultationResponse accept(AuthenticatedUser actor, Long id, String expertNotes) {
        return transition(actor, id, true, consultation -> consultation.accept(expertNotes));
    }

    @Transactional
    public ConsultationResponse decline(AuthenticatedUser actor, Long id, String declineReason) {
        return transition(actor, id, true, consultation -> consultation.decline(declineReason));
    }

    @Transactional
    public ConsultationResponse complete(AuthenticatedUser actor, Long id) {
        return transition(actor, id, true, Consultation::complete);
    }

    @Transactional
    public ConsultationResponse cancel(AuthenticatedUser actor, Long id) {
        return transition(actor, id, false, Consultation::cancel);
    }

    /**
     * Apply a status change after checking who may make it.
     *
     * @param expertOnly Only the booked expert may act; otherwise either participant may
     */
    private ConsultationResponse transition(AuthenticatedUser actor, Long id, boolean expertOnly,
                                            Consumer<Consultation> change) {
        Consultation consultation = consultationRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Consultation", id));

        boolean allowed = expertOnly ? actor.is(consultation.getExpertId()) : consultation.isParticipant(actor.getId());
        if (!allowed) {
            logger.warn("User {} may not change consultation {}", actor.getId(), id);
            throw new AccessDeniedException("You are not allowed to change this consultation");
        }

        ConsultationStatus previous = consultation.getStatus();
        change.accept(consultation);
        consultation = consultationRepository.save(consultation);

        kafkaProducerService.publishConsultationEvent(new ConsultationEvent(
                consultation.getId(), consultation.getFarmerId(), consultation.getExpertId(),
                consultation.getStatus().getValue(), consultation.getConsultationDate(),
                ConsultationEvent.EventType.STATUS_CHANGED));
        metricsService.recordConsultationTransition(consultation.getStatus().getValue());

        logger.info("Consultation {} moved from {} to {} by user {}",
                id, previous, consultation.getStatus(), actor.getId());
        return toResponse(consultation);
    }

    private ConsultationResponse toResponse(Consultation consultation) {
        return ConsultationResponse.fromEntity(consultation,
                userDirectory.summary(consultation.getFarmerId()),
                userDirectory.summary(consultation.getExpertId()));
    }

    private List<ConsultationResponse> toResponses(List<Consultation> consultations) {
        List<Long> userIds = new ArrayList<>();
        consultations.forEach(c -> {
            userIds.add(c.getFarmerId());
            userIds.add(c.getExpertId());
        });
        Map<Long, UserSummary> users = userDirectory.summaries(userIds);
        return consultations.stream()
                .map(c -> ConsultationResponse.fromEntity(c, users.get(c.getFarmerId()), users.get(c.getExpertId())))
                .collect(Collectors.toList());
    }
}
