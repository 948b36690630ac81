package com.siy.style.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HarmonyType {

    ANALOGOUS("analogous"),
    COMPLEMENTARY("complementary"),
    TRIADIC("triadic"),
    NEUTRAL("neutral");

    private final String label;

    HarmonyType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static HarmonyType fromLabel(String value) {
        if (value != null) {
            for (HarmonyType type : values()) {
                if (type.label.equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new StyleEngineException(StyleErrorCode.OUT_OF_RANGE_VALUE, "harmony type " + value);
    }
}
