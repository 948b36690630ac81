package com.siy.style.engine;

import com.siy.style.domain.CategoryL1;
import com.siy.style.domain.ClothingAttributes;
import com.siy.style.domain.FormalityRange;
import com.siy.style.domain.FormalityStatus;
import com.siy.style.domain.StyleEngineException;
import com.siy.style.domain.StyleErrorCode;
import org.springframework.stereotype.Component;

/**
 * Formality compatibility. The status thresholds (1 and 2 levels) are fixed; only the
 * spreads used for recommendation ranges are configurable, per target category and per
 * base/target pair.
 */
@Component
public class FormalityRules {

    static final double OK_MAX_DIFF = 1.0;
    static final double WARNING_MAX_DIFF = 2.0;

    // absorbs binary noise such as |1.2 - 3.2| = 2.0000000000000004
    private static final double EPSILON = 1e-9;

    private final StyleEngineProperties properties;

    public FormalityRules(StyleEngineProperties properties) {
        this.properties = properties;
    }

    public FormalityRange rangeFor(double baseFormality, CategoryL1 target) {
        return rangeFor(baseFormality, null, target);
    }

    public FormalityRange rangeFor(double baseFormality, CategoryL1 baseCategory, CategoryL1 target) {
        requireFormality(baseFormality);
        if (target == null) {
            throw new StyleEngineException(StyleErrorCode.UNKNOWN_CATEGORY, "target category is missing");
        }
        double spread = properties.getFormality().spreadFor(baseCategory, target);
        return new FormalityRange(
            Math.max(ClothingAttributes.MIN_FORMALITY, baseFormality - spread),
            Math.min(ClothingAttributes.MAX_FORMALITY, baseFormality + spread)
        );
    }

    public FormalityStatus statusFor(double baseFormality, double itemFormality) {
        requireFormality(baseFormality);
        requireFormality(itemFormality);
        double diff = Math.abs(baseFormality - itemFormality);
        if (diff <= OK_MAX_DIFF + EPSILON) {
            return FormalityStatus.OK;
        }
        if (diff <= WARNING_MAX_DIFF + EPSILON) {
            return FormalityStatus.WARNING;
        }
        return FormalityStatus.MISMATCH;
    }

    /**
     * Share of the formality penalty, in [0, 1], for a status.
     */
    public double penaltyFor(FormalityStatus status) {
        StyleEngineProperties.Scoring scoring = properties.getScoring();
        return switch (status) {
            case OK -> 0;
            case WARNING -> scoring.getFormalityWarningPenalty();
            case MISMATCH -> scoring.getFormalityMismatchPenalty();
        };
    }

    private static void requireFormality(double formality) {
        if (!(formality >= ClothingAttributes.MIN_FORMALITY && formality <= ClothingAttributes.MAX_FORMALITY)) {
            throw new StyleEngineException(StyleErrorCode.OUT_OF_RANGE_VALUE, "formality " + formality);
        }
    }
}
