package com.retinaai.event;

import com.retinaai.model.ai.RiskSummary;

import java.util.List;

/**
 * Published when an analysis reaches completed. Carries the advisory text
 * produced for the overall risk; the text is not stored on the analysis.
 */
public record AnalysisCompletedEvent(
    Long analysisId,
    Long imageId,
    Long patientId,
    RiskSummary riskSummary,
    String advisory,
    List<String> warnings
) {}
