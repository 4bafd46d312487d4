package com.retinaai.dto.response;

import java.time.LocalDateTime;

public record ModelVersionDto(
    Long id,
    String modelName,
    String version,
    String thresholdConfig,
    LocalDateTime trainedAt,
    boolean active
) {}
