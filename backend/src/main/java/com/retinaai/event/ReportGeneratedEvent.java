package com.retinaai.event;

/**
 * Published when a new medical report is created. Not published when an existing report is returned.
 */
public record ReportGeneratedEvent(
    Long reportId,
    Long analysisId,
    Long patientId,
    String reportUrl
) {}
