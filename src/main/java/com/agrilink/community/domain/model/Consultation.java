package com.agrilink.community.domain.model;

import com.agrilink.community.exception.InvalidStateTransitionException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;

/**
 * Consultation booked by a farmer with an expert.
 *
 * <p>Lifecycle: PENDING -> ACCEPTED | DECLINED, ACCEPTED -> COMPLETED,
 * PENDING | ACCEPTED -> CANCELLED. DECLINED, COMPLETED and CANCELLED are final.
 *
 * @author AgriLink Team
 */
@Entity
@Table(name = "consultations", indexes = {
    @Index(name = "idx_consultations_farmer", columnList = "farmer_id"),
    @Index(name = "idx_consultations_expert", columnList = "expert_id"),
    @Index(name = "idx_consultations_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Consultation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "farmer_id", nullable = false)
    private Long farmerId;

    @Column(name = "expert_id", nullable = false)
    private Long expertId;

    @Column(name = "consultation_date", nullable = false)
    private Instant consultationDate;

    @Column(name = "description", nullable = false, columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ConsultationStatus status;

    @Column(name = "expert_notes", columnDefinition = "TEXT")
    private String expertNotes;

    @Column(name = "decline_reason", columnDefinition = "TEXT")
    private String declineReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
        if (status == null) {
            status = ConsultationStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public void accept(String notes) {
        requireStatus(ConsultationStatus.ACCEPTED, ConsultationStatus.PENDING);
        this.status = ConsultationStatus.ACCEPTED;
        if (notes != null) {
            this.expertNotes = notes;
        }
    }

    public void decline(String reason) {
        requireStatus(ConsultationStatus.DECLINED, ConsultationStatus.PENDING);
        this.status = ConsultationStatus.DECLINED;
        this.declineReason = reason;
    }

    public void complete() {
        requireStatus(ConsultationStatus.COMPLETED, ConsultationStatus.ACCEPTED);
        this.status = ConsultationStatus.COMPLETED;
    }

    public void cancel() {
        requireStatus(ConsultationStatus.CANCELLED, ConsultationStatus.PENDING, ConsultationStatus.ACCEPTED);
        this.status = ConsultationStatus.CANCELLED;
    }

    public boolean isParticipant(Long userId) {
        return userId != null && (userId.equals(farmerId) || userId.equals(expertId));
    }

    private void requireStatus(ConsultationStatus target, ConsultationStatus... allowed) {
        for (ConsultationStatus candidate : allowed) {
            if (status == candidate) {
                return;
            }
        }
        throw new InvalidStateTransitionException("consultation", status.getValue(), target.getValue());
    }

    public enum ConsultationStatus {
        PENDING,
        ACCEPTED,
        DECLINED,
        COMPLETED,
        CANCELLED;

        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
