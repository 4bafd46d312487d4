package com.retinaai.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of an AI analysis.
 *
 * <pre>
 * pending -> processing -> completed
 *                       -> failed
 * </pre>
 *
 * Completed and failed are terminal. A failed analysis no longer counts as the
 * live analysis of its image, so the image may be submitted again.
 */
public enum AnalysisStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    AnalysisStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(AnalysisStatus target) {
        return switch (this) {
            case PENDING -> target == PROCESSING;
            case PROCESSING -> target == COMPLETED || target == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    /**
     * Image status that must accompany this analysis status.
     */
    public ImageStatus imageStatus() {
        return switch (this) {
            case PENDING -> ImageStatus.UPLOADED;
            case PROCESSING -> ImageStatus.PROCESSING;
            case COMPLETED -> ImageStatus.ANALYZED;
            case FAILED -> ImageStatus.ERROR;
        };
    }

    public static AnalysisStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (AnalysisStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown AnalysisStatus: " + value);
    }
}
