package com.retinaai.dto.response;

import java.time.LocalDateTime;

/**
 * Response DTO for an analysis without its findings.
 */
public record AnalysisDto(
    Long id,
    Long imageId,
    Long modelVersionId,
    String modelVersion,
    LocalDateTime analysisTime,
    String status,
    Long processingTimeMs,
    LocalDateTime completedAt,
    String failureReason
) {}
