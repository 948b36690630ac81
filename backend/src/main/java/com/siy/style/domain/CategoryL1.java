package com.siy.style.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum CategoryL1 {

    TOPS("Tops"),
    BOTTOMS("Bottoms"),
    SHOES("Shoes"),
    ACCESSORIES("Accessories"),
    OUTERWEAR("Outerwear"),
    FULL_BODY("Full Body");

    private final String label;

    CategoryL1(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Accepts the display label ("Full Body") or the constant name ("FULL_BODY"), ignoring case.
     */
    public static CategoryL1 fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new StyleEngineException(StyleErrorCode.UNKNOWN_CATEGORY, "category is missing");
        }
        String normalized = value.trim();
        for (CategoryL1 category : values()) {
            if (category.label.equalsIgnoreCase(normalized)
                || category.name().equals(normalized.toUpperCase(Locale.ROOT).replace(' ', '_'))) {
                return category;
            }
        }
        throw new StyleEngineException(StyleErrorCode.UNKNOWN_CATEGORY, value);
    }
}
