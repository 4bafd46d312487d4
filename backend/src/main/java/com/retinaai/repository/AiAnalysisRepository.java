package com.retinaai.repository;

import com.retinaai.model.ai.AiAnalysis;
import com.retinaai.model.enums.AnalysisStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository for AI analyses.
 */
@Repository
public interface AiAnalysisRepository extends JpaRepository<AiAnalysis, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AiAnalysis a WHERE a.id = :id")
    Optional<AiAnalysis> findByIdForUpdate(@Param("id") Long id);

    /**
     * Live analysis of an image: the one that is not failed. At most one exists.
     */
    Optional<AiAnalysis> findFirstByImageIdAndStatusNot(Long imageId, AnalysisStatus status);

    boolean existsByImageId(Long imageId);

    boolean existsByModelVersionId(Long modelVersionId);

    List<AiAnalysis> findByImageIdOrderByAnalysisTimeDesc(Long imageId);

    List<AiAnalysis> findByStatus(AnalysisStatus status);

    long countByStatus(AnalysisStatus status);

    @Query("SELECT AVG(a.processingTimeMs) FROM AiAnalysis a WHERE a.processingTimeMs IS NOT NULL")
    Double averageProcessingTimeMs();

    /**
     * Analyses of a patient's images, newest first, bounded by analysis time.
     */
    @Query("""
        SELECT a FROM AiAnalysis a
        WHERE a.image.patientId = :patientId
          AND a.analysisTime BETWEEN :from AND :to
        ORDER BY a.analysisTime DESC, a.id DESC
        """)
    List<AiAnalysis> findPatientHistory(
            @Param("patientId") Long patientId,
            @Param("from") LocalDateTime from,
            @Param("to") LocalDateTime to,
            Pageable pageable);
}
