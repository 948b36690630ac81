package com.siy.style.engine;

import com.siy.style.domain.CategoryRecommendation;
import com.siy.style.domain.GarmentColor;
import com.siy.style.domain.HarmonyType;
import com.siy.style.domain.Hsl;
import com.siy.style.domain.InventoryMatchResult;
import com.siy.style.domain.MatchCriteria;
import com.siy.style.domain.RankedItem;
import com.siy.style.domain.RecommendedColor;
import com.siy.style.domain.StoredItem;
import com.siy.style.domain.StyleEngineException;
import com.siy.style.domain.StyleErrorCode;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Ranks stored items of the recommended category by color closeness and formality fit.
 * Ties go to the most recently created item.
 */
@Component
public class InventoryMatcher {

    private static final Comparator<RankedItem> RANKING = Comparator
        .comparingInt(RankedItem::score).reversed()
        .thenComparing(ranked -> ranked.item().createdAt(), Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
        .thenComparing(ranked -> ranked.item().id(), Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final ColorModel colorModel;
    private final StyleEngineProperties properties;

    public InventoryMatcher(ColorModel colorModel, StyleEngineProperties properties) {
        this.colorModel = colorModel;
        this.properties = properties;
    }

    public InventoryMatchResult matches(CategoryRecommendation recommendation, List<StoredItem> storedItems, int limit) {
        return matches(MatchCriteria.from(recommendation), storedItems, limit);
    }

    public InventoryMatchResult matches(MatchCriteria criteria, List<StoredItem> storedItems, int limit) {
        int maxLimit = properties.getInventory().getMaxLimit();
        if (limit < 1 || limit > maxLimit) {
            throw new StyleEngineException(StyleErrorCode.OUT_OF_RANGE_VALUE, "limit " + limit + " not in [1, " + maxLimit + "]");
        }
        if (storedItems == null || storedItems.isEmpty()) {
            return new InventoryMatchResult(List.of(), 0);
        }

        List<StoredItem> inCategory = storedItems.stream()
            .filter(item -> item.attributes().l1() == criteria.categoryL1())
            .toList();

        List<RankedItem> ranked = inCategory.stream()
            .map(item -> new RankedItem(item, score(criteria, item)))
            .sorted(RANKING)
            .limit(limit)
            .toList();

        return new InventoryMatchResult(ranked, inCategory.size());
    }

    /**
     * Match score in [0, 100]: the color share scales with the best similarity to any
     * recommended color, the formality share drops per level outside the range.
     */
    int score(MatchCriteria criteria, StoredItem item) {
        StyleEngineProperties.Inventory config = properties.getInventory();
        GarmentColor color = item.attributes().color();

        double bestSimilarity = 0;
        for (RecommendedColor recommended : criteria.colors()) {
            bestSimilarity = Math.max(bestSimilarity, similarity(recommended, color));
        }
        double colorScore = config.getColorWeight() * bestSimilarity;

        double outside = criteria.formalityRange().distanceOutside(item.attributes().formality());
        double formalityScore = Math.max(0, config.getFormalityWeight() - outside * config.getFormalityPenaltyPerLevel());

        return (int) Math.max(0, Math.min(100, Math.round(colorScore + formalityScore)));
    }

    /**
     * 1 for the same hue (or the same lightness between two neutrals), falling to 0 at the
     * configured hue falloff. A neutral never matches a chromatic color.
     */
    private double similarity(RecommendedColor recommended, GarmentColor color) {
        Hsl recommendedHsl = colorModel.hexToHsl(recommended.hex());
        boolean recommendedNeutral = recommended.harmonyType() == HarmonyType.NEUTRAL
            || colorModel.classifyNeutral(recommendedHsl);

        if (recommendedNeutral != color.neutral()) {
            return 0;
        }
        if (recommendedNeutral) {
            return 1 - Math.abs(recommendedHsl.lightness() - color.hsl().lightness()) / 100;
        }
        double hueDistance = ColorHarmonyEngine.hueDistance(recommendedHsl.hue(), color.hsl().hue());
        return Math.max(0, 1 - hueDistance / properties.getInventory().getHueFalloffDegrees());
    }
}
