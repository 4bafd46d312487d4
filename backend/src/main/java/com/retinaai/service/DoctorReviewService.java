package com.retinaai.service;

import com.retinaai.exception.ConflictException;
import com.retinaai.exception.NotFoundException;
import com.retinaai.exception.PreconditionException;
import com.retinaai.exception.ValidationException;
import com.retinaai.model.ai.AiAnalysis;
import com.retinaai.model.enums.AnalysisStatus;
import com.retinaai.model.enums.ValidationStatus;
import com.retinaai.model.medical.DoctorReview;
import com.retinaai.model.medical.ReviewAmendment;
import com.retinaai.repository.AiAnalysisRepository;
import com.retinaai.repository.DoctorReviewRepository;
import com.retinaai.repository.MedicalReportRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Review Gate
 *
 * A doctor approves or rejects a completed analysis. The review sits beside the
 * analysis without changing it and is consulted by report generation. Once a
 * report has been generated from a review, the review can no longer be amended.
 */
@Service
@Transactional
@Slf4j
public class DoctorReviewService {

    private static final int MAX_COMMENT_LENGTH = 1000;

    private final DoctorReviewRepository reviewRepository;
    private final AiAnalysisRepository analysisRepository;
    private final MedicalReportRepository reportRepository;
    private final Clock clock;

    public DoctorReviewService(
            DoctorReviewRepository reviewRepository,
            AiAnalysisRepository analysisRepository,
            MedicalReportRepository reportRepository,
            Clock clock) {
        this.reviewRepository = reviewRepository;
        this.analysisRepository = analysisRepository;
        this.reportRepository = reportRepository;
        this.clock = clock;
    }

    /**
     * Submit the single review of a completed analysis.
     */
    public DoctorReview submitReview(Long analysisId, Long doctorId, ValidationStatus decision, String comment) {
        if (doctorId == null) {
            throw new ValidationException("Doctor id is required");
        }
        String normalizedComment = validateVerdict(decision, comment);

        AiAnalysis analysis = analysisRepository.findById(analysisId)
            .orElseThrow(() -> new NotFoundException("AI analysis not found: " + analysisId));
        if (analysis.getStatus() != AnalysisStatus.COMPLETED) {
            throw new PreconditionException("Analysis " + analysisId + " is "
                + analysis.getStatus().getValue() + "; only completed analyses can be reviewed");
        }
        if (reviewRepository.existsByAnalysisId(analysisId)) {
            throw new ConflictException("Analysis " + analysisId + " has already been reviewed");
        }

        DoctorReview review;
        try {
            review = reviewRepository.saveAndFlush(DoctorReview.builder()
                .analysis(analysis)
                .doctorId(doctorId)
                .validationStatus(decision)
                .comment(normalizedComment)
                .reviewedAt(LocalDateTime.now(clock))
                .build());
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Analysis " + analysisId + " has already been reviewed", e);
        }

        log.info("Doctor {} {} analysis {} (review {})", doctorId, decision.getValue(), analysisId, review.getId());
        return review;
    }

    /**
     * Replace the verdict of a review that no report has consumed yet.
     * Serialized with {@link MedicalReportService#generate(Long)} on the review row.
     */
    public DoctorReview amendReview(Long reviewId, ReviewAmendment amendment) {
        if (amendment == null) {
            throw new ValidationException("Amendment is required");
        }
        DoctorReview review = reviewRepository.findByIdForUpdate(reviewId)
            .orElseThrow(() -> new NotFoundException("Doctor review not found: " + reviewId));

        // report generation holds the same row lock, so a report committed meanwhile is visible here
        Long analysisId = review.getAnalysis().getId();
        if (reportRepository.existsByAnalysisId(analysisId)) {
            throw new ConflictException("Review " + reviewId + " is referenced by the report of analysis "
                + analysisId + " and can no longer be amended");
        }

        review.setComment(validateVerdict(amendment.decision(), amendment.comment()));
        review.setValidationStatus(amendment.decision());
        review.setReviewedAt(LocalDateTime.now(clock));

        log.info("Review {} of analysis {} amended to {}", reviewId, analysisId, amendment.decision().getValue());
        return reviewRepository.save(review);
    }

    // ========================================================================
    // Queries
    // ========================================================================

    @Transactional(readOnly = true)
    public DoctorReview getById(Long reviewId) {
        return reviewRepository.findById(reviewId)
            .orElseThrow(() -> new NotFoundException("Doctor review not found: " + reviewId));
    }

    @Transactional(readOnly = true)
    public Optional<DoctorReview> findByAnalysis(Long analysisId) {
        return reviewRepository.findByAnalysisId(analysisId);
    }

    @Transactional(readOnly = true)
    public List<DoctorReview> findByDoctor(Long doctorId) {
        return reviewRepository.findByDoctorIdOrderByReviewedAtDesc(doctorId);
    }

    /**
     * Reviews opened without a verdict yet, oldest first.
     */
    @Transactional(readOnly = true)
    public List<DoctorReview> findPending() {
        return reviewRepository.findByValidationStatusOrderByReviewedAtAsc(ValidationStatus.PENDING);
    }

    @Transactional(readOnly = true)
    public ReviewStatistics getStatistics() {
        Map<ValidationStatus, Long> counts = new EnumMap<>(ValidationStatus.class);
        long total = 0;
        for (ValidationStatus status : ValidationStatus.values()) {
            long count = reviewRepository.countByValidationStatus(status);
            counts.put(status, count);
            total += count;
        }
        long approved = counts.get(ValidationStatus.APPROVED);
        long decided = approved + counts.get(ValidationStatus.REJECTED);
        double approvalRate = decided == 0 ? 0.0 : Math.round(approved * 10000.0 / decided) / 100.0;
        return new ReviewStatistics(total, counts, approvalRate);
    }

    // ========================================================================
    // Private Helpers
    // ========================================================================

    /**
     * @return the trimmed comment, null when blank
     */
    private String validateVerdict(ValidationStatus decision, String comment) {
        if (decision == null) {
            throw new ValidationException("Decision is required");
        }
        String trimmed = comment == null || comment.isBlank() ? null : comment.trim();
        if (decision == ValidationStatus.REJECTED && trimmed == null) {
            throw new ValidationException("Comment is required when rejecting an analysis");
        }
        if (trimmed != null && trimmed.length() > MAX_COMMENT_LENGTH) {
            throw new ValidationException("Comment exceeds " + MAX_COMMENT_LENGTH + " characters");
        }
        return trimmed;
    }
}
