package com.retinaai.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UpdateReportUrlRequest(
    @NotBlank(message = "Report URL is required")
    @Size(max = 500)
    String reportUrl
) {}
