package com.retinaai.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for a doctor's review of a completed analysis.
 * A comment is mandatory when the decision is rejected.
 */
public record SubmitReviewRequest(
    @NotNull(message = "Analysis id is required")
    Long analysisId,

    @NotNull(message = "Doctor id is required")
    Long doctorId,

    // pending, approved, rejected
    @NotBlank(message = "Decision is required")
    String decision,

    String comment
) {}
