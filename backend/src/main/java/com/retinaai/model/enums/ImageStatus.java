package com.retinaai.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of an uploaded retinal image. Mirrors the status of its current analysis.
 */
public enum ImageStatus {
    UPLOADED("uploaded"),
    PROCESSING("processing"),
    ANALYZED("analyzed"),
    ERROR("error");

    private final String value;

    ImageStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ImageStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ImageStatus item : values()) {
            if (item.value.equalsIgnoreCase(value)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown ImageStatus: " + value);
    }
}
