package com.siy.style.engine;

import com.siy.style.catalog.StyleTaxonomy;
import com.siy.style.catalog.StyleTaxonomy.SubCategory;
import com.siy.style.domain.CategoryL1;
import com.siy.style.domain.CategoryRecommendation;
import com.siy.style.domain.ClothingAttributes;
import com.siy.style.domain.FormalityRange;
import com.siy.style.domain.RecommendedColor;
import com.siy.style.domain.StyleEngineException;
import com.siy.style.domain.StyleErrorCode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Builds one recommendation per target category from the base item's color, formality and
 * aesthetics. Output depends only on the inputs and the static tables.
 */
@Component
public class RecommendationGenerator {

    private static final List<CategoryL1> FULL_BODY_TARGETS = List.of(
        CategoryL1.SHOES,
        CategoryL1.ACCESSORIES,
        CategoryL1.OUTERWEAR
    );

    private static final String EXAMPLE_TEMPLATE = "%s in %s to complete your %s";

    private final ColorHarmonyEngine colorHarmonyEngine;
    private final FormalityRules formalityRules;
    private final AestheticMatcher aestheticMatcher;

    public RecommendationGenerator(
        ColorHarmonyEngine colorHarmonyEngine,
        FormalityRules formalityRules,
        AestheticMatcher aestheticMatcher
    ) {
        this.colorHarmonyEngine = colorHarmonyEngine;
        this.formalityRules = formalityRules;
        this.aestheticMatcher = aestheticMatcher;
    }

    /**
     * Recommendations for {@code targets} in the given order, or for the default targets of
     * the base category when {@code targets} is null or empty.
     */
    public List<CategoryRecommendation> generate(ClothingAttributes base, List<CategoryL1> targets) {
        List<CategoryL1> resolvedTargets = targets == null || targets.isEmpty()
            ? defaultTargets(base.l1())
            : List.copyOf(new LinkedHashSet<>(targets));

        List<CategoryRecommendation> recommendations = new ArrayList<>();
        for (CategoryL1 target : resolvedTargets) {
            recommendations.add(recommend(base, target));
        }
        return List.copyOf(recommendations);
    }

    public List<CategoryL1> defaultTargets(CategoryL1 baseCategory) {
        if (baseCategory == CategoryL1.FULL_BODY) {
            return FULL_BODY_TARGETS;
        }
        return Arrays.stream(CategoryL1.values())
            .filter(category -> category != baseCategory)
            .toList();
    }

    public CategoryRecommendation recommend(ClothingAttributes base, CategoryL1 target) {
        if (target == null) {
            throw new StyleEngineException(StyleErrorCode.UNKNOWN_CATEGORY, "target category is missing");
        }
        List<RecommendedColor> colors = colorHarmonyEngine.harmonize(base.color());
        FormalityRange range = formalityRules.rangeFor(base.formality(), base.l1(), target);
        Set<String> aesthetics = aestheticMatcher.suggestTags(base.aesthetics(), target);
        List<String> suggestedL2 = suggestSubCategories(target, range, base.formality());

        return new CategoryRecommendation(
            target,
            colors,
            range,
            aesthetics,
            suggestedL2,
            example(target, colors, suggestedL2)
        );
    }

    /**
     * Sub-categories typically worn inside the range, closest to the base formality first.
     * When none fall inside, the single closest sub-category is suggested.
     */
    List<String> suggestSubCategories(CategoryL1 target, FormalityRange range, double baseFormality) {
        List<SubCategory> candidates = StyleTaxonomy.subCategories(target);
        Comparator<SubCategory> byCloseness =
            Comparator.comparingDouble(subCategory -> Math.abs(subCategory.formalityMidpoint() - baseFormality));

        List<String> inRange = candidates.stream()
            .filter(subCategory -> range.contains(subCategory.formalityMidpoint()))
            .sorted(byCloseness)
            .map(SubCategory::name)
            .toList();
        if (!inRange.isEmpty()) {
            return inRange;
        }

        return candidates.stream()
            .min(Comparator.comparingDouble(subCategory -> range.distanceOutside(subCategory.formalityMidpoint())))
            .map(subCategory -> List.of(subCategory.name()))
            .orElse(List.of());
    }

    private static String example(CategoryL1 target, List<RecommendedColor> colors, List<String> suggestedL2) {
        String piece = suggestedL2.isEmpty() ? target.label() : suggestedL2.get(0);
        String color = colors.isEmpty() ? "a matching color" : colors.get(0).name();
        return String.format(Locale.ROOT, EXAMPLE_TEMPLATE, piece, color, target.label().toLowerCase(Locale.ROOT));
    }
}
