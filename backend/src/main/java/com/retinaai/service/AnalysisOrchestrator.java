package com.retinaai.service;

import com.retinaai.event.AnalysisCompletedEvent;
import com.retinaai.event.AnalysisFailedEvent;
import com.retinaai.exception.ConflictException;
import com.retinaai.exception.NotFoundException;
import com.retinaai.exception.PreconditionException;
import com.retinaai.exception.ValidationException;
import com.retinaai.model.ai.AiAnalysis;
import com.retinaai.model.ai.AiModelVersion;
import com.retinaai.model.ai.RiskSummary;
import com.retinaai.model.enums.AnalysisStatus;
import com.retinaai.model.imaging.RetinalImage;
import com.retinaai.repository.AiAnalysisRepository;
import com.retinaai.repository.AiModelVersionRepository;
import com.retinaai.repository.RetinalImageRepository;
import com.retinaai.scoring.DiseaseFinding;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Analysis Orchestrator
 *
 * Drives an analysis through pending -> processing -> completed | failed.
 * Every transition updates the analysis and its image in one transaction so
 * that image status always mirrors analysis status:
 * - processing  <-> processing
 * - completed   <-> analyzed
 * - failed      <-> error
 *
 * Terminal analyses are never changed. Running again means submitting a new
 * analysis once the previous one has failed.
 */
@Service
@Transactional
@Slf4j
public class AnalysisOrchestrator {

    private static final int MAX_REASON_LENGTH = 1000;
    private static final int MAX_PAGE_SIZE = 1000;
    private static final LocalDateTime HISTORY_START = LocalDateTime.of(1970, 1, 1, 0, 0);
    private static final LocalDateTime HISTORY_END = LocalDateTime.of(9999, 12, 31, 23, 59, 59);

    private final AiAnalysisRepository analysisRepository;
    private final RetinalImageRepository imageRepository;
    private final AiModelVersionRepository modelVersionRepository;
    private final AnalysisResultService resultService;
    private final RecommendationService recommendationService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public AnalysisOrchestrator(
            AiAnalysisRepository analysisRepository,
            RetinalImageRepository imageRepository,
            AiModelVersionRepository modelVersionRepository,
            AnalysisResultService resultService,
            RecommendationService recommendationService,
            ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this.analysisRepository = analysisRepository;
        this.imageRepository = imageRepository;
        this.modelVersionRepository = modelVersionRepository;
        this.resultService = resultService;
        this.recommendationService = recommendationService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    // ========================================================================
    // Transitions
    // ========================================================================

    /**
     * Create an analysis for the image with the active model and start it.
     * The image row stays locked until commit so concurrent submits for the
     * same image are serialized and only one of them succeeds.
     */
    public AiAnalysis submit(Long imageId) {
        RetinalImage image = imageRepository.findByIdForUpdate(imageId)
            .orElseThrow(() -> new NotFoundException("Retinal image not found: " + imageId));

        Optional<AiAnalysis> live = analysisRepository.findFirstByImageIdAndStatusNot(imageId, AnalysisStatus.FAILED);
        if (live.isPresent()) {
            throw new ConflictException("Retinal image " + imageId + " already has a "
                + live.get().getStatus().getValue() + " analysis: " + live.get().getId());
        }

        AiModelVersion model = modelVersionRepository.findFirstByActiveTrue()
            .orElseThrow(() -> new PreconditionException("No active AI model version"));

        AiAnalysis analysis = analysisRepository.save(AiAnalysis.builder()
            .image(image)
            .modelVersion(model)
            .analysisTime(LocalDateTime.now(clock))
            .status(AnalysisStatus.PENDING)
            .build());

        transition(analysis, AnalysisStatus.PROCESSING);

        log.info("Started analysis {} for image {} with model {} {}",
            analysis.getId(), imageId, model.getModelName(), model.getVersion());
        return analysis;
    }

    /**
     * Record the scorer output and complete a processing analysis.
     */
    public AiAnalysis complete(Long analysisId, List<DiseaseFinding> findings, String heatmapUrl) {
        return complete(analysisId, findings, heatmapUrl, null);
    }

    /**
     * Record the scorer output and complete a processing analysis.
     * Publishes {@link AnalysisCompletedEvent} with advisory text for the overall risk.
     */
    public AiAnalysis complete(Long analysisId, List<DiseaseFinding> findings,
                               String heatmapUrl, String annotationDescription) {
        AiAnalysis analysis = lockAnalysis(analysisId);
        requireStatus(analysis, AnalysisStatus.PROCESSING, "complete");

        RiskSummary summary = resultService.recordFindings(analysis, findings, heatmapUrl, annotationDescription);

        LocalDateTime now = LocalDateTime.now(clock);
        analysis.setCompletedAt(now);
        analysis.setProcessingTimeMs(Math.max(0L, Duration.between(analysis.getAnalysisTime(), now).toMillis()));
        transition(analysis, AnalysisStatus.COMPLETED);

        String advisory = recommendationService.advise(summary.highestRisk(), summary.diseaseLabel());
        List<String> warnings = summary.hasFindings()
            ? recommendationService.warn(summary.highestRisk(), summary.confidence())
            : List.of();

        eventPublisher.publishEvent(new AnalysisCompletedEvent(
            analysis.getId(),
            analysis.getImage().getId(),
            analysis.getImage().getPatientId(),
            summary,
            advisory,
            warnings));

        log.info("Completed analysis {} in {} ms: {} finding(s), overall risk {}",
            analysisId, analysis.getProcessingTimeMs(), summary.findingCount(), summary.describe());
        return analysis;
    }

    /**
     * Fail a processing analysis. The reason is kept on the analysis; no retry is scheduled.
     */
    public AiAnalysis fail(Long analysisId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("Failure reason is required");
        }
        AiAnalysis analysis = lockAnalysis(analysisId);
        requireStatus(analysis, AnalysisStatus.PROCESSING, "fail");

        String trimmed = reason.trim();
        analysis.setFailureReason(trimmed.length() > MAX_REASON_LENGTH ? trimmed.substring(0, MAX_REASON_LENGTH) : trimmed);
        transition(analysis, AnalysisStatus.FAILED);

        eventPublisher.publishEvent(new AnalysisFailedEvent(
            analysis.getId(),
            analysis.getImage().getId(),
            analysis.getImage().getPatientId(),
            analysis.getFailureReason()));

        log.warn("Analysis {} failed: {}", analysisId, analysis.getFailureReason());
        return analysis;
    }

    // ========================================================================
    // Queries
    // ========================================================================

    @Transactional(readOnly = true)
    public AiAnalysis getById(Long analysisId) {
        return analysisRepository.findById(analysisId)
            .orElseThrow(() -> new NotFoundException("AI analysis not found: " + analysisId));
    }

    /**
     * The live (non-failed) analysis of an image, if any.
     */
    @Transactional(readOnly = true)
    public Optional<AiAnalysis> findCurrentByImage(Long imageId) {
        return analysisRepository.findFirstByImageIdAndStatusNot(imageId, AnalysisStatus.FAILED);
    }

    /**
     * Every analysis of an image including failed ones, newest first.
     */
    @Transactional(readOnly = true)
    public List<AiAnalysis> findAllByImage(Long imageId) {
        return analysisRepository.findByImageIdOrderByAnalysisTimeDesc(imageId);
    }

    @Transactional(readOnly = true)
    public List<AiAnalysis> findByStatus(AnalysisStatus status) {
        return analysisRepository.findByStatus(status);
    }

    /**
     * Analyses of a patient's images, newest first, with optional inclusive date bounds.
     */
    @Transactional(readOnly = true)
    public List<AiAnalysis> findPatientHistory(Long patientId, int page, int size,
                                               LocalDate startDate, LocalDate endDate) {
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new ValidationException("Page size must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (page < 0) {
            throw new ValidationException("Page must be non-negative");
        }
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            throw new ValidationException("End date must not be before start date");
        }

        LocalDateTime from = startDate != null ? startDate.atStartOfDay() : HISTORY_START;
        LocalDateTime to = endDate != null ? endDate.atTime(LocalTime.MAX) : HISTORY_END;
        return analysisRepository.findPatientHistory(patientId, from, to, PageRequest.of(page, size));
    }

    @Transactional(readOnly = true)
    public AnalysisStatistics getStatistics() {
        Map<AnalysisStatus, Long> counts = new EnumMap<>(AnalysisStatus.class);
        long total = 0;
        for (AnalysisStatus status : AnalysisStatus.values()) {
            long count = analysisRepository.countByStatus(status);
            counts.put(status, count);
            total += count;
        }
        Double average = analysisRepository.averageProcessingTimeMs();
        return new AnalysisStatistics(total, counts, average != null ? average : 0.0);
    }

    // ========================================================================
    // Private Helpers
    // ========================================================================

    private AiAnalysis lockAnalysis(Long analysisId) {
        return analysisRepository.findByIdForUpdate(analysisId)
            .orElseThrow(() -> new NotFoundException("AI analysis not found: " + analysisId));
    }

    private void requireStatus(AiAnalysis analysis, AnalysisStatus expected, String operation) {
        if (analysis.getStatus() != expected) {
            throw new ConflictException("Cannot " + operation + " analysis " + analysis.getId()
                + " in status " + analysis.getStatus().getValue());
        }
    }

    /**
     * Move the analysis and its image together.
     */
    private void transition(AiAnalysis analysis, AnalysisStatus target) {
        if (!analysis.getStatus().canTransitionTo(target)) {
            throw new ConflictException("Illegal transition " + analysis.getStatus().getValue()
                + " -> " + target.getValue() + " for analysis " + analysis.getId());
        }
        analysis.setStatus(target);
        analysis.getImage().setStatus(target.imageStatus());
    }
}
