package com.retinaai.dto.response;

import java.time.LocalDateTime;

public record RetinalImageDto(
    Long id,
    Long patientId,
    Long clinicId,
    Long uploadedBy,
    String imageType,
    String eyeSide,
    String imageUrl,
    LocalDateTime uploadTime,
    String status
) {}
