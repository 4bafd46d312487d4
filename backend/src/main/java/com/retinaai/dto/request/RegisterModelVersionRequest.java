package com.retinaai.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for registering a model version.
 */
public record RegisterModelVersionRequest(
    @NotBlank(message = "Model name is required")
    @Size(max = 100)
    String modelName,

    @NotBlank(message = "Version is required")
    @Size(max = 50)
    String version,

    @NotBlank(message = "Threshold configuration is required")
    @Size(max = 1000)
    String thresholdConfig
) {}
