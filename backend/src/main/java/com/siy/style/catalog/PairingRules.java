package com.siy.style.catalog;

import com.siy.style.domain.CategoryL1;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Structural outfit rules: which bottoms each shoe style pairs with, how many items of one
 * category an outfit may hold, and the overall item cap.
 */
public final class PairingRules {

    public static final int MAX_OUTFIT_ITEMS = 6;

    private static final Map<String, List<String>> SHOE_BOTTOM_PAIRINGS = buildShoeBottomPairings();
    private static final Map<CategoryL1, Integer> CATEGORY_LIMITS = buildCategoryLimits();
    private static final List<CategoryL1> SEPARATES_REQUIRED =
        List.of(CategoryL1.TOPS, CategoryL1.BOTTOMS, CategoryL1.SHOES);
    private static final List<CategoryL1> FULL_BODY_REQUIRED = List.of(CategoryL1.SHOES);

    private PairingRules() {
    }

    /**
     * Bottoms (or full-body L2s) the given shoe style pairs with; empty when the style has no rule.
     */
    public static Optional<List<String>> allowedBottomsFor(String shoeL2) {
        if (shoeL2 == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(SHOE_BOTTOM_PAIRINGS.get(shoeL2.trim().toLowerCase(Locale.ROOT)));
    }

    public static int maxItemsPerCategory(CategoryL1 category) {
        return CATEGORY_LIMITS.get(category);
    }

    /**
     * Categories a complete outfit must contain. A full-body piece stands in for both top and bottom.
     */
    public static List<CategoryL1> requiredCategories(boolean fullBodyPresent) {
        return fullBodyPresent ? FULL_BODY_REQUIRED : SEPARATES_REQUIRED;
    }

    private static Map<String, List<String>> buildShoeBottomPairings() {
        Map<String, List<String>> pairings = new HashMap<>();
        pairings.put("oxfords", List.of("Dress Pants", "Chinos", "Suits"));
        pairings.put("loafers", List.of("Dress Pants", "Chinos", "Suits", "Jeans"));
        pairings.put("sneakers", List.of("Jeans", "Joggers", "Shorts", "Chinos"));
        pairings.put("boots", List.of("Jeans", "Chinos", "Dress Pants"));
        pairings.put("sandals", List.of("Shorts", "Jeans", "Skirts", "Dresses"));
        pairings.put("heels", List.of("Dresses", "Dress Pants", "Skirts", "Suits"));
        return Collections.unmodifiableMap(pairings);
    }

    private static Map<CategoryL1, Integer> buildCategoryLimits() {
        Map<CategoryL1, Integer> limits = new EnumMap<>(CategoryL1.class);
        for (CategoryL1 category : CategoryL1.values()) {
            limits.put(category, 1);
        }
        limits.put(CategoryL1.TOPS, 2);
        limits.put(CategoryL1.ACCESSORIES, 3);
        return Collections.unmodifiableMap(limits);
    }
}
