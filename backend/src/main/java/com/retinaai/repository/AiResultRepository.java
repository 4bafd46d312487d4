package com.retinaai.repository;

import com.retinaai.model.ai.AiResult;
import com.retinaai.model.enums.RiskLevel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for per-disease AI results.
 */
@Repository
public interface AiResultRepository extends JpaRepository<AiResult, Long> {

    List<AiResult> findByAnalysisIdOrderByIdAsc(Long analysisId);

    List<AiResult> findByRiskLevelIn(Collection<RiskLevel> levels);

    List<AiResult> findByDiseaseTypeIgnoreCase(String diseaseType);

    long countByAnalysisId(Long analysisId);

    long countByRiskLevel(RiskLevel riskLevel);
}
