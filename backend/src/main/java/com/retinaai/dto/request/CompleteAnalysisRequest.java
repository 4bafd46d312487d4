package com.retinaai.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.util.List;

/**
 * Request DTO carrying scorer output for a processing analysis.
 */
public record CompleteAnalysisRequest(
    @Valid
    List<FindingRequest> findings,

    @NotBlank(message = "Heatmap URL is required")
    String heatmapUrl,

    String description
) {

    public record FindingRequest(
        @NotBlank(message = "Disease type is required")
        String disease,

        @NotBlank(message = "Risk level is required")
        String risk,

        @NotNull(message = "Confidence is required")
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        BigDecimal confidence
    ) {}
}
