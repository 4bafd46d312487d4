package com.retinaai.dto.response;

import java.util.Map;

public record ReviewStatsDto(
    long totalReviews,
    Map<String, Long> byStatus,
    double approvalRate
) {}
