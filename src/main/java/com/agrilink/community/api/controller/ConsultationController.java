package com.agrilink.community.api.controller;

import com.agrilink.community.api.dto.AcceptConsultationRequest;
import com.agrilink.community.api.dto.ConsultationResponse;
import com.agrilink.community.api.dto.CreateConsultationRequest;
import com.agrilink.community.api.dto.DeclineConsultationRequest;
import com.agrilink.community.security.SecurityUtils;
import com.agrilink.community.service.ConsultationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for expert consultations.
 * Farmers book; the booked expert accepts, declines or completes; either side may cancel.
 *
 * @author AgriLink Team
 */
@RestController
@RequestMapping("/api/consultations")
@PreAuthorize("isAuthenticated()")
@Tag(name = "Consultations", description = "Booking sessions with experts")
@SecurityRequirement(name = "bearerAuth")
public class ConsultationController {

    private final ConsultationService consultationService;

    public ConsultationController(ConsultationService consultationService) {
        this.consultationService = consultationService;
    }

    @PostMapping
    @Operation(summary = "Book a consultation with an expert")
    public ResponseEntity<ConsultationResponse> book(@Valid @RequestBody CreateConsultationRequest request) {
        ConsultationResponse booked = consultationService.bookConsultation(SecurityUtils.requireCurrentUser(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(booked);
    }

    @GetMapping("/my-bookings")
    @Operation(summary = "Consultations the caller booked")
    public ResponseEntity<List<ConsultationResponse>> myBookings() {
        return ResponseEntity.ok(consultationService.listFarmerBookings(SecurityUtils.requireCurrentUser()));
    }

    @GetMapping("/my-expert-bookings")
    @Operation(summary = "Consultations booked with the caller as expert")
    public ResponseEntity<List<ConsultationResponse>> myExpertBookings() {
        return ResponseEntity.ok(consultationService.listExpertBookings(SecurityUtils.requireCurrentUser()));
    }

    /**
     * Accept a pending booking. The body and its expert_notes are optional.
     */
    @PatchMapping("/{id}/accept")
    @Operation(summary = "Accept a booking (expert)")
    public ResponseEntity<ConsultationResponse> accept(@PathVariable Long id,
                                                       @Valid @RequestBody(required = false) AcceptConsultationRequest request) {
        String notes = request == null ? null : request.getExpertNotes();
        return ResponseEntity.ok(consultationService.accept(SecurityUtils.requireCurrentUser(), id, notes));
    }

    @PatchMapping("/{id}/decline")
    @Operation(summary = "Decline a booking (expert)")
    public ResponseEntity<ConsultationResponse> decline(@PathVariable Long id,
                                                        @Valid @RequestBody DeclineConsultationRequest request) {
        return ResponseEntity.ok(consultationService.decline(SecurityUtils.requireCurrentUser(), id, request.getDeclineReason()));
    }

    @PatchMapping("/{id}/complete")
    @Operation(summary = "Mark an accepted booking completed (expert)")
    public ResponseEntity<ConsultationResponse> complete(@PathVariable Long id) {
        return ResponseEntity.ok(consultationService.complete(SecurityUtils.requireCurrentUser(), id));
    }

    @PatchMapping("/{id}/cancel")
    @Operation(summary = "Cancel a booking (farmer or expert)")
    public ResponseEntity<ConsultationResponse> cancel(@PathVariable Long id) {
        return ResponseEntity.ok(consultationService.cancel(SecurityUtils.requireCurrentUser(), id));
    }
}
