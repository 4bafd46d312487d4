package com.retinaai.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Acquisition modality of a retinal image.
 */
public enum ImageType {
    FUNDUS("fundus"),
    OCT("oct"),
    FLUORESCEIN("fluorescein"),
    ANGIOGRAPHY("angiography");

    private final String value;

    ImageType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ImageType fromValue(String value) {
        for (ImageType item : values()) {
            if (item.value.equalsIgnoreCase(value)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown ImageType: " + value);
    }
}
