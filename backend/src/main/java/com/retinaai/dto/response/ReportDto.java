package com.retinaai.dto.response;

import java.time.LocalDateTime;

public record ReportDto(
    Long id,
    Long analysisId,
    Long patientId,
    Long doctorId,
    String reportUrl,
    String recommendation,
    LocalDateTime createdAt
) {}
