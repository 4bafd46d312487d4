package com.retinaai.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Milestone tag carried by a notification.
 */
public enum NotificationType {
    AI_RESULT_READY("ai_result_ready"),
    ANALYSIS_FAILED("analysis_failed"),
    REPORT_READY("report_ready");

    private final String value;

    NotificationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static NotificationType fromValue(String value) {
        for (NotificationType item : values()) {
            if (item.value.equalsIgnoreCase(value)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown NotificationType: " + value);
    }
}
