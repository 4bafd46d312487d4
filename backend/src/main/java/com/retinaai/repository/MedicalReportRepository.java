package com.retinaai.repository;

import com.retinaai.model.medical.MedicalReport;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for medical reports.
 */
@Repository
public interface MedicalReportRepository extends JpaRepository<MedicalReport, Long> {

    Optional<MedicalReport> findByAnalysisId(Long analysisId);

    boolean existsByAnalysisId(Long analysisId);

    List<MedicalReport> findByPatientIdOrderByCreatedAtDesc(Long patientId);

    List<MedicalReport> findByPatientIdOrderByCreatedAtDesc(Long patientId, Pageable pageable);

    List<MedicalReport> findByDoctorIdOrderByCreatedAtDesc(Long doctorId);
}
