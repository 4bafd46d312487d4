package com.retinaai.dto.response;

import java.time.LocalDateTime;

public record ReviewDto(
    Long id,
    Long analysisId,
    Long doctorId,
    String validationStatus,
    String comment,
    LocalDateTime reviewedAt
) {}
