package com.retinaai.repository;

import com.retinaai.model.enums.ValidationStatus;
import com.retinaai.model.medical.DoctorReview;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for doctor reviews.
 */
@Repository
public interface DoctorReviewRepository extends JpaRepository<DoctorReview, Long> {

    Optional<DoctorReview> findByAnalysisId(Long analysisId);

    boolean existsByAnalysisId(Long analysisId);

    /**
     * Load a review and hold a write lock on its row until the transaction ends.
     * Amendment and report generation both go through this lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM DoctorReview r WHERE r.id = :id")
    Optional<DoctorReview> findByIdForUpdate(@Param("id") Long id);

    /**
     * Locking variant of {@link #findByAnalysisId(Long)}.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM DoctorReview r WHERE r.analysis.id = :analysisId")
    Optional<DoctorReview> findByAnalysisIdForUpdate(@Param("analysisId") Long analysisId);

    List<DoctorReview> findByDoctorIdOrderByReviewedAtDesc(Long doctorId);

    List<DoctorReview> findByValidationStatusOrderByReviewedAtAsc(ValidationStatus status);

    long countByValidationStatus(ValidationStatus status);
}
