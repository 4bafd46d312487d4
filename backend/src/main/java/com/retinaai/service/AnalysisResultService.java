package com.retinaai.service;

import com.retinaai.exception.ConflictException;
import com.retinaai.exception.NotFoundException;
import com.retinaai.exception.ValidationException;
import com.retinaai.model.ai.AiAnalysis;
import com.retinaai.model.ai.AiAnnotation;
import com.retinaai.model.ai.AiResult;
import com.retinaai.model.ai.RiskSummary;
import com.retinaai.model.enums.RiskLevel;
import com.retinaai.repository.AiAnalysisRepository;
import com.retinaai.repository.AiAnnotationRepository;
import com.retinaai.repository.AiResultRepository;
import com.retinaai.scoring.DiseaseFinding;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Result & Annotation Store
 *
 * Holds the per-disease findings of an analysis (many per analysis) and its
 * heatmap annotation (exactly one per completed analysis).
 */
@Service
@Transactional(readOnly = true)
public class AnalysisResultService {

    private static final int MAX_DISEASE_TYPE_LENGTH = 100;
    private static final int MAX_URL_LENGTH = 500;
    private static final int MAX_DESCRIPTION_LENGTH = 1000;

    private final AiResultRepository resultRepository;
    private final AiAnnotationRepository annotationRepository;
    private final AiAnalysisRepository analysisRepository;

    public AnalysisResultService(
            AiResultRepository resultRepository,
            AiAnnotationRepository annotationRepository,
            AiAnalysisRepository analysisRepository) {
        this.resultRepository = resultRepository;
        this.annotationRepository = annotationRepository;
        this.analysisRepository = analysisRepository;
    }

    /**
     * Validate the scorer findings and attach them, with the annotation, to the analysis.
     * Nothing is attached if any finding is invalid. Rows are written when the
     * surrounding transaction flushes.
     *
     * @return risk summary over the attached results
     */
    @Transactional
    public RiskSummary recordFindings(AiAnalysis analysis, List<DiseaseFinding> findings,
                                      String heatmapUrl, String description) {
        if (heatmapUrl == null || heatmapUrl.isBlank()) {
            throw new ValidationException("Heatmap URL is required to complete an analysis");
        }
        if (heatmapUrl.length() > MAX_URL_LENGTH) {
            throw new ValidationException("Heatmap URL exceeds " + MAX_URL_LENGTH + " characters");
        }
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException("Annotation description exceeds " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        if (analysis.getAnnotation() != null || annotationRepository.existsByAnalysisId(analysis.getId())) {
            throw new ConflictException("Analysis " + analysis.getId() + " already has an annotation");
        }

        List<AiResult> results = new ArrayList<>();
        if (findings != null) {
            for (DiseaseFinding finding : findings) {
                results.add(toResult(finding));
            }
        }

        results.forEach(analysis::addResult);
        analysis.attachAnnotation(AiAnnotation.builder()
            .heatmapUrl(heatmapUrl.trim())
            .description(description)
            .build());

        return RiskSummary.of(results);
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public List<AiResult> getResults(Long analysisId) {
        requireAnalysis(analysisId);
        return resultRepository.findByAnalysisIdOrderByIdAsc(analysisId);
    }

    public Optional<AiAnnotation> findAnnotation(Long analysisId) {
        requireAnalysis(analysisId);
        return annotationRepository.findByAnalysisId(analysisId);
    }

    /**
     * Overall risk of an analysis: maximum level, all diseases at that level kept.
     */
    public RiskSummary summarize(Long analysisId) {
        return RiskSummary.of(getResults(analysisId));
    }

    /**
     * All results at high or critical risk.
     */
    public List<AiResult> findHighRiskResults() {
        return resultRepository.findByRiskLevelIn(EnumSet.of(RiskLevel.HIGH, RiskLevel.CRITICAL));
    }

    public List<AiResult> findByDiseaseType(String diseaseType) {
        return resultRepository.findByDiseaseTypeIgnoreCase(diseaseType);
    }

    public long countByRiskLevel(RiskLevel riskLevel) {
        return resultRepository.countByRiskLevel(riskLevel);
    }

    // ========================================================================
    // Private Helpers
    // ========================================================================

    private AiResult toResult(DiseaseFinding finding) {
        if (finding == null) {
            throw new ValidationException("Finding must not be null");
        }
        if (finding.diseaseType() == null || finding.diseaseType().isBlank()) {
            throw new ValidationException("Disease type is required");
        }
        if (finding.diseaseType().trim().length() > MAX_DISEASE_TYPE_LENGTH) {
            throw new ValidationException("Disease type exceeds " + MAX_DISEASE_TYPE_LENGTH + " characters");
        }
        if (finding.riskLevel() == null) {
            throw new ValidationException("Risk level is required for " + finding.diseaseType());
        }
        BigDecimal confidence = finding.confidence();
        if (confidence == null || confidence.signum() < 0 || confidence.compareTo(BigDecimal.ONE) > 0) {
            throw new ValidationException("Confidence for " + finding.diseaseType()
                + " must be between 0 and 1, got: " + confidence);
        }

        return AiResult.builder()
            .diseaseType(finding.diseaseType().trim())
            .riskLevel(finding.riskLevel())
            .confidenceScore(confidence.setScale(2, RoundingMode.HALF_UP))
            .build();
    }

    private void requireAnalysis(Long analysisId) {
        if (!analysisRepository.existsById(analysisId)) {
            throw new NotFoundException("AI analysis not found: " + analysisId);
        }
    }
}
