package com.siy.style.catalog;

import com.siy.style.domain.CategoryL1;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Aesthetic tags that suit a base tag when the recommended piece belongs to a given
 * category, e.g. Streetwear base pieces go with Athleisure shoes.
 */
public final class AestheticCompatibilityTable {

    private static final Map<CategoryL1, Map<String, List<String>>> TABLE = buildTable();

    private AestheticCompatibilityTable() {
    }

    public static List<String> compatibleTags(CategoryL1 target, String baseTag) {
        if (baseTag == null) {
            return List.of();
        }
        return TABLE.get(target).getOrDefault(baseTag.trim().toLowerCase(Locale.ROOT), List.of());
    }

    private static Map<CategoryL1, Map<String, List<String>>> buildTable() {
        // keys are lower-case base tags
        Map<CategoryL1, Map<String, List<String>>> table = new EnumMap<>(CategoryL1.class);

        table.put(CategoryL1.TOPS, Map.of(
            "athleisure", List.of("Streetwear"),
            "classic", List.of("Preppy"),
            "bohemian", List.of("Vintage")
        ));
        table.put(CategoryL1.BOTTOMS, Map.of(
            "streetwear", List.of("Athleisure"),
            "preppy", List.of("Classic"),
            "minimalist", List.of("Classic")
        ));
        table.put(CategoryL1.SHOES, Map.of(
            "streetwear", List.of("Athleisure"),
            "athleisure", List.of("Streetwear"),
            "minimalist", List.of("Classic"),
            "classic", List.of("Minimalist", "Preppy"),
            "preppy", List.of("Classic"),
            "bohemian", List.of("Vintage"),
            "vintage", List.of("Bohemian"),
            "edgy", List.of("Streetwear")
        ));
        table.put(CategoryL1.ACCESSORIES, Map.of(
            "minimalist", List.of("Classic"),
            "classic", List.of("Minimalist"),
            "preppy", List.of("Classic"),
            "bohemian", List.of("Vintage"),
            "vintage", List.of("Classic"),
            "edgy", List.of("Vintage"),
            "streetwear", List.of("Edgy")
        ));
        table.put(CategoryL1.OUTERWEAR, Map.of(
            "streetwear", List.of("Edgy"),
            "edgy", List.of("Streetwear"),
            "classic", List.of("Preppy", "Minimalist"),
            "minimalist", List.of("Classic"),
            "preppy", List.of("Classic"),
            "athleisure", List.of("Streetwear"),
            "vintage", List.of("Classic")
        ));
        table.put(CategoryL1.FULL_BODY, Map.of(
            "classic", List.of("Minimalist"),
            "bohemian", List.of("Vintage")
        ));

        return Collections.unmodifiableMap(table);
    }
}
