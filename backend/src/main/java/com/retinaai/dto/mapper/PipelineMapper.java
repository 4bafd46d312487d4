package com.retinaai.dto.mapper;

import com.retinaai.dto.request.CompleteAnalysisRequest;
import com.retinaai.dto.response.*;
import com.retinaai.dto.response.AnalysisDetailDto.AnnotationDto;
import com.retinaai.dto.response.AnalysisDetailDto.ResultDto;
import com.retinaai.exception.ValidationException;
import com.retinaai.model.ai.*;
import com.retinaai.model.enums.AnalysisStatus;
import com.retinaai.model.enums.RiskLevel;
import com.retinaai.model.enums.ValidationStatus;
import com.retinaai.model.imaging.RetinalImage;
import com.retinaai.model.medical.DoctorReview;
import com.retinaai.model.medical.MedicalReport;
import com.retinaai.model.notification.Notification;
import com.retinaai.scoring.DiseaseFinding;
import com.retinaai.service.AnalysisStatistics;
import com.retinaai.service.ReviewStatistics;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Mapper for converting between pipeline entities and DTOs.
 */
@Component
public class PipelineMapper {

    // ========================================================================
    // Entity -> DTO Conversions
    // ========================================================================

    public ModelVersionDto toDto(AiModelVersion entity) {
        return new ModelVersionDto(
            entity.getId(),
            entity.getModelName(),
            entity.getVersion(),
            entity.getThresholdConfig(),
            entity.getTrainedAt(),
            entity.isActive()
        );
    }

    public RetinalImageDto toDto(RetinalImage entity) {
        return new RetinalImageDto(
            entity.getId(),
            entity.getPatientId(),
            entity.getClinicId(),
            entity.getUploadedBy(),
            entity.getImageType().getValue(),
            entity.getEyeSide().getValue(),
            entity.getImageUrl(),
            entity.getUploadTime(),
            entity.getStatus().getValue()
        );
    }

    public AnalysisDto toDto(AiAnalysis entity) {
        return new AnalysisDto(
            entity.getId(),
            entity.getImage().getId(),
            entity.getModelVersion().getId(),
            entity.getModelVersion().getVersion(),
            entity.getAnalysisTime(),
            entity.getStatus().getValue(),
            entity.getProcessingTimeMs(),
            entity.getCompletedAt(),
            entity.getFailureReason()
        );
    }

    public AnalysisDetailDto toDetailDto(AiAnalysis analysis, List<AiResult> results, AiAnnotation annotation) {
        RiskSummary summary = RiskSummary.of(results);
        return new AnalysisDetailDto(
            toDto(analysis),
            results.stream().map(this::toDto).toList(),
            annotation != null ? new AnnotationDto(annotation.getId(), annotation.getHeatmapUrl(), annotation.getDescription()) : null,
            summary.hasFindings() ? summary.highestRisk().getValue() : null,
            summary.diseaseTypes()
        );
    }

    public ResultDto toDto(AiResult entity) {
        return new ResultDto(
            entity.getId(),
            entity.getDiseaseType(),
            entity.getRiskLevel().getValue(),
            entity.getConfidenceScore()
        );
    }

    public ReviewDto toDto(DoctorReview entity) {
        return new ReviewDto(
            entity.getId(),
            entity.getAnalysis().getId(),
            entity.getDoctorId(),
            entity.getValidationStatus().getValue(),
            entity.getComment(),
            entity.getReviewedAt()
        );
    }

    public ReportDto toDto(MedicalReport entity) {
        return new ReportDto(
            entity.getId(),
            entity.getAnalysis().getId(),
            entity.getPatientId(),
            entity.getDoctorId(),
            entity.getReportUrl(),
            entity.getRecommendation(),
            entity.getCreatedAt()
        );
    }

    public NotificationDto toDto(Notification entity) {
        return new NotificationDto(
            entity.getId(),
            entity.getAccountId(),
            entity.getType().getValue(),
            entity.getContent(),
            entity.isRead(),
            entity.getCreatedAt()
        );
    }

    public AnalysisStatsDto toDto(AnalysisStatistics statistics) {
        return new AnalysisStatsDto(
            statistics.total(),
            byValue(statistics.byStatus(), AnalysisStatus::getValue),
            statistics.averageProcessingTimeMs()
        );
    }

    public ReviewStatsDto toDto(ReviewStatistics statistics) {
        return new ReviewStatsDto(
            statistics.total(),
            byValue(statistics.byStatus(), ValidationStatus::getValue),
            statistics.approvalRate()
        );
    }

    // ========================================================================
    // Request -> Domain Conversions
    // ========================================================================

    public List<DiseaseFinding> toFindings(List<CompleteAnalysisRequest.FindingRequest> requests) {
        if (requests == null) {
            return List.of();
        }
        return requests.stream()
            .map(r -> new DiseaseFinding(r.disease(), parse(r.risk(), RiskLevel::fromValue, "risk level"), r.confidence()))
            .toList();
    }

    /**
     * Parse an enum wire value, turning unknown values into a validation error.
     */
    public <E> E parse(String value, Function<String, E> parser, String field) {
        try {
            E parsed = parser.apply(value);
            if (parsed == null) {
                throw new ValidationException("Missing " + field);
            }
            return parsed;
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid " + field + ": " + value);
        }
    }

    private static <K> Map<String, Long> byValue(Map<K, Long> counts, Function<K, String> key) {
        Map<String, Long> result = new LinkedHashMap<>();
        counts.forEach((k, v) -> result.put(key.apply(k), v));
        return result;
    }
}
