package com.agrilink.community.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeclineConsultationRequest {

    @NotBlank(message = "Decline reason is required")
    private String declineReason;
}
