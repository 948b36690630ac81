package com.siy.style.domain;

public record FormalityRange(double min, double max) {

    public FormalityRange {
        if (!(min >= ClothingAttributes.MIN_FORMALITY && max <= ClothingAttributes.MAX_FORMALITY && min <= max)) {
            throw new StyleEngineException(StyleErrorCode.OUT_OF_RANGE_VALUE, "formality range [" + min + ", " + max + "]");
        }
    }

    public boolean contains(double formality) {
        return formality >= min && formality <= max;
    }

    /**
     * Formality levels between {@code formality} and the nearest bound; zero when inside.
     */
    public double distanceOutside(double formality) {
        if (formality < min) {
            return min - formality;
        }
        if (formality > max) {
            return formality - max;
        }
        return 0;
    }
}
