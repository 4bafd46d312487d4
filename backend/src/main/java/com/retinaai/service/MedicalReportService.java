package com.retinaai.service;

import com.retinaai.event.ReportGeneratedEvent;
import com.retinaai.exception.ConflictException;
import com.retinaai.exception.NotFoundException;
import com.retinaai.exception.PreconditionException;
import com.retinaai.exception.ValidationException;
import com.retinaai.model.ai.AiAnalysis;
import com.retinaai.model.ai.RiskSummary;
import com.retinaai.model.enums.AnalysisStatus;
import com.retinaai.model.enums.ValidationStatus;
import com.retinaai.model.medical.DoctorReview;
import com.retinaai.model.medical.MedicalReport;
import com.retinaai.repository.AiAnalysisRepository;
import com.retinaai.repository.DoctorReviewRepository;
import com.retinaai.repository.MedicalReportRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Report Generator
 *
 * Produces the single medical report of an analysis once it is completed and
 * approved by a doctor. Generating again returns the existing report.
 */
@Service
@Transactional
@Slf4j
public class MedicalReportService {

    private final MedicalReportRepository reportRepository;
    private final AiAnalysisRepository analysisRepository;
    private final DoctorReviewRepository reviewRepository;
    private final AnalysisResultService resultService;
    private final RecommendationService recommendationService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Value("${retina.report.base-url:/reports}")
    private String reportBaseUrl;

    public MedicalReportService(
            MedicalReportRepository reportRepository,
            AiAnalysisRepository analysisRepository,
            DoctorReviewRepository reviewRepository,
            AnalysisResultService resultService,
            RecommendationService recommendationService,
            ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this.reportRepository = reportRepository;
        this.analysisRepository = analysisRepository;
        this.reviewRepository = reviewRepository;
        this.resultService = resultService;
        this.recommendationService = recommendationService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Generate the report of an approved analysis, or return the one already generated.
     * The review row stays locked until commit, so the approval cannot be amended while
     * the report is written and concurrent callers all receive the same report.
     */
    public MedicalReport generate(Long analysisId) {
        Optional<MedicalReport> existing = reportRepository.findByAnalysisId(analysisId);
        if (existing.isPresent()) {
            log.debug("Report {} already exists for analysis {}", existing.get().getId(), analysisId);
            return existing.get();
        }

        AiAnalysis analysis = analysisRepository.findById(analysisId)
            .orElseThrow(() -> new NotFoundException("AI analysis not found: " + analysisId));
        if (analysis.getStatus() != AnalysisStatus.COMPLETED) {
            throw new PreconditionException("Analysis " + analysisId + " is "
                + analysis.getStatus().getValue() + "; a report requires a completed analysis");
        }

        DoctorReview review = reviewRepository.findByAnalysisIdForUpdate(analysisId)
            .orElseThrow(() -> new PreconditionException("Analysis " + analysisId + " has not been reviewed"));

        // a caller that waited on the review lock returns the report its predecessor committed
        Optional<MedicalReport> committed = reportRepository.findByAnalysisId(analysisId);
        if (committed.isPresent()) {
            return committed.get();
        }
        if (review.getValidationStatus() != ValidationStatus.APPROVED) {
            throw new PreconditionException("Analysis " + analysisId + " review is "
                + review.getValidationStatus().getValue() + "; a report requires approval");
        }

        RiskSummary summary = resultService.summarize(analysisId);
        String recommendation = recommendationService.advise(summary.highestRisk(), summary.diseaseLabel())
            + "\n\n" + recommendationService.prevent(summary.highestRisk());

        MedicalReport report;
        try {
            report = reportRepository.saveAndFlush(MedicalReport.builder()
                .analysis(analysis)
                .patientId(analysis.getImage().getPatientId())
                .doctorId(review.getDoctorId())
                .reportUrl(buildReportUrl(analysisId))
                .recommendation(recommendation)
                .createdAt(LocalDateTime.now(clock))
                .build());
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("A report for analysis " + analysisId + " is being generated concurrently", e);
        }

        eventPublisher.publishEvent(new ReportGeneratedEvent(
            report.getId(), analysisId, report.getPatientId(), report.getReportUrl()));

        log.info("Generated report {} for analysis {} (overall risk {})", report.getId(), analysisId, summary.describe());
        return report;
    }

    public MedicalReport updateReportUrl(Long reportId, String reportUrl) {
        if (reportUrl == null || reportUrl.isBlank()) {
            throw new ValidationException("Report URL is required");
        }
        MedicalReport report = getById(reportId);
        report.setReportUrl(reportUrl.trim());
        return reportRepository.save(report);
    }

    // ========================================================================
    // Queries
    // ========================================================================

    @Transactional(readOnly = true)
    public MedicalReport getById(Long reportId) {
        return reportRepository.findById(reportId)
            .orElseThrow(() -> new NotFoundException("Medical report not found: " + reportId));
    }

    @Transactional(readOnly = true)
    public Optional<MedicalReport> findByAnalysis(Long analysisId) {
        return reportRepository.findByAnalysisId(analysisId);
    }

    @Transactional(readOnly = true)
    public List<MedicalReport> findByPatient(Long patientId) {
        return reportRepository.findByPatientIdOrderByCreatedAtDesc(patientId);
    }

    @Transactional(readOnly = true)
    public List<MedicalReport> findRecentByPatient(Long patientId, int limit) {
        if (limit < 1) {
            throw new ValidationException("Limit must be positive");
        }
        return reportRepository.findByPatientIdOrderByCreatedAtDesc(patientId, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public List<MedicalReport> findByDoctor(Long doctorId) {
        return reportRepository.findByDoctorIdOrderByCreatedAtDesc(doctorId);
    }

    private String buildReportUrl(Long analysisId) {
        String base = reportBaseUrl.endsWith("/") ? reportBaseUrl.substring(0, reportBaseUrl.length() - 1) : reportBaseUrl;
        return base + "/analysis-" + analysisId + ".pdf";
    }
}
