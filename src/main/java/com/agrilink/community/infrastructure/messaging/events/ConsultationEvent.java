package com.agrilink.community.infrastructure.messaging.events;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Consultation lifecycle event. Consumers notify the farmer or the expert.
 *
 * @author AgriLink Team
 */
@Data
@NoArgsConstructor
public class ConsultationEvent {

    private Long consultationId;
    private Long farmerId;
    private Long expertId;
    private String status;
    private Instant consultationDate;
    private EventType eventType;
    private Instant timestamp;

    public ConsultationEvent(Long consultationId, Long farmerId, Long expertId, String status,
                             Instant consultationDate, EventType eventType) {
        this.consultationId = consultationId;
        this.farmerId = farmerId;
        this.expertId = expertId;
        this.status = status;
        this.consultationDate = consultationDate;
        this.eventType = eventType;
        this.timestamp = Instant.now();
    }

    public enum EventType {
        BOOKED,
        STATUS_CHANGED
    }
}
