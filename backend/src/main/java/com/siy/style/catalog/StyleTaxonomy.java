package com.siy.style.catalog;

import com.siy.style.domain.CategoryL1;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed category taxonomy (L1 to L2), the formality scale and the known aesthetic tags.
 * Each L2 carries the formality its garments are typically worn at.
 */
public final class StyleTaxonomy {

    private static final Map<CategoryL1, List<SubCategory>> SUB_CATEGORIES = buildSubCategories();
    private static final Map<Integer, String> FORMALITY_LEVELS = buildFormalityLevels();
    private static final List<String> AESTHETIC_TAGS = List.of(
        "Minimalist",
        "Streetwear",
        "Classic",
        "Preppy",
        "Bohemian",
        "Athleisure",
        "Vintage",
        "Edgy"
    );

    private StyleTaxonomy() {
    }

    public static List<SubCategory> subCategories(CategoryL1 category) {
        return SUB_CATEGORIES.get(category);
    }

    public static Map<Integer, String> formalityLevels() {
        return FORMALITY_LEVELS;
    }

    public static List<String> aestheticTags() {
        return AESTHETIC_TAGS;
    }

    public record SubCategory(String name, double formalityMidpoint) {
    }

    private static Map<CategoryL1, List<SubCategory>> buildSubCategories() {
        Map<CategoryL1, List<SubCategory>> table = new EnumMap<>(CategoryL1.class);
        table.put(CategoryL1.TOPS, List.of(
            new SubCategory("T-Shirts", 1.5),
            new SubCategory("Polos", 2.0),
            new SubCategory("Casual Shirts", 2.5),
            new SubCategory("Dress Shirts", 4.0),
            new SubCategory("Sweaters", 2.5),
            new SubCategory("Hoodies", 1.0),
            new SubCategory("Blazers", 4.0)
        ));
        table.put(CategoryL1.BOTTOMS, List.of(
            new SubCategory("Jeans", 1.5),
            new SubCategory("Chinos", 2.5),
            new SubCategory("Dress Pants", 4.0),
            new SubCategory("Shorts", 1.0),
            new SubCategory("Joggers", 1.0),
            new SubCategory("Skirts", 2.5)
        ));
        table.put(CategoryL1.SHOES, List.of(
            new SubCategory("Sneakers", 1.5),
            new SubCategory("Loafers", 3.0),
            new SubCategory("Oxfords", 4.5),
            new SubCategory("Boots", 2.5),
            new SubCategory("Sandals", 1.0),
            new SubCategory("Heels", 4.0)
        ));
        table.put(CategoryL1.ACCESSORIES, List.of(
            new SubCategory("Watches", 3.0),
            new SubCategory("Belts", 3.0),
            new SubCategory("Bags", 2.5),
            new SubCategory("Hats", 1.5),
            new SubCategory("Scarves", 2.5),
            new SubCategory("Jewelry", 3.5),
            new SubCategory("Sunglasses", 2.0)
        ));
        table.put(CategoryL1.OUTERWEAR, List.of(
            new SubCategory("Jackets", 2.0),
            new SubCategory("Coats", 3.5),
            new SubCategory("Vests", 3.0)
        ));
        table.put(CategoryL1.FULL_BODY, List.of(
            new SubCategory("Dresses", 3.0),
            new SubCategory("Suits", 4.5)
        ));
        return Collections.unmodifiableMap(table);
    }

    private static Map<Integer, String> buildFormalityLevels() {
        Map<Integer, String> levels = new LinkedHashMap<>();
        levels.put(1, "Casual");
        levels.put(2, "Smart Casual");
        levels.put(3, "Business Casual");
        levels.put(4, "Formal");
        levels.put(5, "Black Tie");
        return Collections.unmodifiableMap(levels);
    }
}
