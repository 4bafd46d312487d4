package com.retinaai.repository;

import com.retinaai.model.ai.AiAnnotation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for analysis annotations.
 */
@Repository
public interface AiAnnotationRepository extends JpaRepository<AiAnnotation, Long> {

    Optional<AiAnnotation> findByAnalysisId(Long analysisId);

    boolean existsByAnalysisId(Long analysisId);
}
