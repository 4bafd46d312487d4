package com.retinaai.dto.request;

import jakarta.validation.constraints.Size;

/**
 * Request DTO for updating a model version. Omitted fields are left unchanged.
 */
public record UpdateModelVersionRequest(
    @Size(max = 100)
    String modelName,

    @Size(max = 1000)
    String thresholdConfig
) {}
