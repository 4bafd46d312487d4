package com.retinaai.model.ai;

/**
 * Fields of a model version that may be changed after registration.
 * Null leaves the field unchanged. Version string and active flag are not updatable here.
 */
public record ModelVersionUpdate(
    String modelName,
    String thresholdConfig
) {}
