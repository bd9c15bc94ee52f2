package com.agrilink.community.api.dto;

import jakarta.validation.constraints.Future;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request DTO for booking a consultation with an expert.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateConsultationRequest {

    @NotNull(message = "Expert ID is required")
    private Long expertId;

    @NotNull(message = "Consultation date is required")
    @Future(message = "Consultation date must be in the future")
    private Instant consultationDate;

    @NotBlank(message = "Description is required")
    private String description;
}
