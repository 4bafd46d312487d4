package com.retinaai.dto.request;

import jakarta.validation.constraints.NotBlank;

public record FailAnalysisRequest(
    @NotBlank(message = "Reason is required")
    String reason
) {}
