package com.retinaai.dto.response;

import java.util.Map;

public record AnalysisStatsDto(
    long totalAnalyses,
    Map<String, Long> byStatus,
    double averageProcessingTimeMs
) {}
