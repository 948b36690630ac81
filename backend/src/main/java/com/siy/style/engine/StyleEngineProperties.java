package com.siy.style.engine;

import com.siy.style.domain.CategoryL1;
import java.util.EnumMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "style.engine")
public class StyleEngineProperties {

    private Color color = new Color();

    private Formality formality = new Formality();

    private Scoring scoring = new Scoring();

    private Inventory inventory = new Inventory();

    @Getter
    @Setter
    public static class Color {

        private double neutralSaturationMax = 15;

        private double neutralDarkLightnessMax = 10;

        private double neutralLightLightnessMin = 90;

        private double wearableSaturationMin = 20;

        private double wearableSaturationMax = 70;

        private double wearableLightnessMin = 25;

        private double wearableLightnessMax = 75;

        private double analogousOffsetDegrees = 30;

        private double triadicOffsetDegrees = 120;
    }

    @Getter
    @Setter
    public static class Formality {

        private double topsSpread = 1.0;

        private double bottomsSpread = 1.0;

        private double shoesSpread = 1.5;

        private double accessoriesSpread = 1.5;

        private double outerwearSpread = 0.5;

        private double fullBodySpread = 1.0;

        // base category -> target category -> spread, overriding the target's own spread
        private Map<CategoryL1, Map<CategoryL1, Double>> pairSpreads = defaultPairSpreads();

        /**
         * Spread for recommending {@code target} next to a {@code base} item, falling back to
         * the target's own spread when the pair has no override.
         */
        public double spreadFor(CategoryL1 base, CategoryL1 target) {
            if (base != null) {
                Map<CategoryL1, Double> overrides = pairSpreads.get(base);
                if (overrides != null && overrides.get(target) != null) {
                    return overrides.get(target);
                }
            }
            return spreadFor(target);
        }

        public double spreadFor(CategoryL1 category) {
            return switch (category) {
                case TOPS -> topsSpread;
                case BOTTOMS -> bottomsSpread;
                case SHOES -> shoesSpread;
                case ACCESSORIES -> accessoriesSpread;
                case OUTERWEAR -> outerwearSpread;
                case FULL_BODY -> fullBodySpread;
            };
        }

        private static Map<CategoryL1, Map<CategoryL1, Double>> defaultPairSpreads() {
            Map<CategoryL1, Double> overFullBody = new EnumMap<>(CategoryL1.class);
            overFullBody.put(CategoryL1.OUTERWEAR, 1.0);

            Map<CategoryL1, Map<CategoryL1, Double>> spreads = new EnumMap<>(CategoryL1.class);
            spreads.put(CategoryL1.FULL_BODY, overFullBody);
            return spreads;
        }
    }

    @Getter
    @Setter
    public static class Scoring {

        private double colorWeight = 40;

        private double formalityWeight = 35;

        private double aestheticWeight = 25;

        private double harmonyToleranceDegrees = 15;

        // hue distance past the tolerance at which the color penalty is full
        private double colorPenaltySpanDegrees = 30;

        private double formalityWarningPenalty = 0.5;

        private double formalityMismatchPenalty = 1.0;
    }

    @Getter
    @Setter
    public static class Inventory {

        private double colorWeight = 50;

        private double formalityWeight = 50;

        private double formalityPenaltyPerLevel = 15;

        private double hueFalloffDegrees = 90;

        private int maxLimit = 10;
    }
}
