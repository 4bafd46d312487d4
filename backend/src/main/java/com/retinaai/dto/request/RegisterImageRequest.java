package com.retinaai.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for registering an uploaded retinal image.
 */
public record RegisterImageRequest(
    @NotNull(message = "Patient id is required")
    Long patientId,

    Long clinicId,

    @NotNull(message = "Uploader id is required")
    Long uploadedBy,

    // fundus, oct, fluorescein, angiography
    @NotBlank(message = "Image type is required")
    String imageType,

    // left, right, both
    @NotBlank(message = "Eye side is required")
    String eyeSide,

    @NotBlank(message = "Image URL is required")
    @Size(max = 500)
    String imageUrl
) {}
