package com.retinaai.service;

import com.retinaai.model.enums.ValidationStatus;

import java.util.Map;

/**
 * Review counts per verdict. The approval rate is the share of decided
 * reviews (approved or rejected) that were approved, in percent.
 */
public record ReviewStatistics(
    long total,
    Map<ValidationStatus, Long> byStatus,
    double approvalRate
) {}
