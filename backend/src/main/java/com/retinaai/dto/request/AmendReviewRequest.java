package com.retinaai.dto.request;

import jakarta.validation.constraints.NotBlank;

public record AmendReviewRequest(
    @NotBlank(message = "Decision is required")
    String decision,

    String comment
) {}
