package com.agrilink.community.api.dto;

import com.agrilink.community.domain.model.Consultation;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
public class ConsultationResponse {

    private Long id;
    private Long farmerId;
    private UserSummary farmer;
    private Long expertId;
    private UserSummary expert;
    private Instant consultationDate;
    private String description;
    private String status;
    private String expertNotes;
    private String declineReason;
    private Instant createdAt;
    private Instant updatedAt;

    public static ConsultationResponse fromEntity(Consultation consultation, UserSummary farmer, UserSummary expert) {
        ConsultationResponse response = new ConsultationResponse();
        response.setId(consultation.getId());
        response.setFarmerId(consultation.getFarmerId());
        response.setFarmer(farmer);
        response.setExpertId(consultation.getExpertId());
        response.setExpert(expert);
        response.setConsultationDate(consultation.getConsultationDate());
        response.setDescription(consultation.getDescription());
        response.setStatus(consultation.getStatus().getValue());
        response.setExpertNotes(consultation.getExpertNotes());
        response.setDeclineReason(consultation.getDeclineReason());
        response.setCreatedAt(consultation.getCreatedAt());
        response.setUpdatedAt(consultation.getUpdatedAt());
        return response;
    }
}
