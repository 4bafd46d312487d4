package com.retinaai.service;

import com.retinaai.model.enums.AnalysisStatus;

import java.util.Map;

/**
 * Analysis counts per status and the mean processing time of completed analyses.
 */
public record AnalysisStatistics(
    long total,
    Map<AnalysisStatus, Long> byStatus,
    double averageProcessingTimeMs
) {}
