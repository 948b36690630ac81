package com.siy.style.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The attributes of one garment that recommendation and validation operate on.
 */
public record ClothingAttributes(
    GarmentColor color,
    Category category,
    double formality,
    Set<String> aesthetics
) {

    public static final double MIN_FORMALITY = 1.0;
    public static final double MAX_FORMALITY = 5.0;

    public ClothingAttributes {
        if (color == null) {
            throw new StyleEngineException(StyleErrorCode.INVALID_COLOR_FORMAT, "color is missing");
        }
        if (category == null) {
            throw new StyleEngineException(StyleErrorCode.UNKNOWN_CATEGORY, "category is missing");
        }
        if (!(formality >= MIN_FORMALITY && formality <= MAX_FORMALITY)) {
            throw new StyleEngineException(StyleErrorCode.OUT_OF_RANGE_VALUE, "formality " + formality);
        }
        Set<String> tags = new LinkedHashSet<>();
        if (aesthetics != null) {
            for (String tag : aesthetics) {
                if (tag != null && !tag.isBlank()) {
                    tags.add(tag.trim());
                }
            }
        }
        aesthetics = Collections.unmodifiableSet(tags);
    }

    public CategoryL1 l1() {
        return category.l1();
    }
}
