package com.agrilink.community.repository;

import com.agrilink.community.domain.model.Consultation;
import com.agrilink.community.domain.model.Consultation.ConsultationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ConsultationRepository extends JpaRepository<Consultation, Long> {

    List<Consultation> findByFarmerIdOrderByCreatedAtDesc(Long farmerId);

    List<Consultation> findByExpertIdOrderByCreatedAtDesc(Long expertId);

    long countByStatus(ConsultationStatus status);
}
