package com.retinaai.event;

/**
 * Published when an analysis moves to failed.
 */
public record AnalysisFailedEvent(
    Long analysisId,
    Long imageId,
    Long patientId,
    String reason
) {}
