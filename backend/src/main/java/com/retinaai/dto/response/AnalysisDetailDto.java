package com.retinaai.dto.response;

import java.math.BigDecimal;
import java.util.List;

/**
 * Response DTO for an analysis with its findings, annotation and overall risk.
 */
public record AnalysisDetailDto(
    AnalysisDto analysis,
    List<ResultDto> results,
    AnnotationDto annotation,
    String overallRisk,
    List<String> overallRiskDiseases
) {

    public record ResultDto(
        Long id,
        String diseaseType,
        String riskLevel,
        BigDecimal confidenceScore
    ) {}

    public record AnnotationDto(
        Long id,
        String heatmapUrl,
        String description
    ) {}
}
