package com.retinaai.dto.response;

import java.time.LocalDateTime;

public record NotificationDto(
    Long id,
    Long accountId,
    String type,
    String content,
    boolean read,
    LocalDateTime createdAt
) {}
