package com.retinaai.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which eye a retinal image was taken of.
 */
public enum EyeSide {
    LEFT("left"),
    RIGHT("right"),
    BOTH("both");

    private final String value;

    EyeSide(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static EyeSide fromValue(String value) {
        for (EyeSide item : values()) {
            if (item.value.equalsIgnoreCase(value)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown EyeSide: " + value);
    }
}
