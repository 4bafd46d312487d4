package com.retinaai.model.medical;

import com.retinaai.model.enums.ValidationStatus;

/**
 * New verdict for an existing review. Both fields replace the stored values.
 */
public record ReviewAmendment(
    ValidationStatus decision,
    String comment
) {}
