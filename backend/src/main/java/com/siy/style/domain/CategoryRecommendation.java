package com.siy.style.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * What pairs with the base item in one target category. Colors and sub-categories are
 * ordered most relevant first.
 */
public record CategoryRecommendation(
    CategoryL1 categoryL1,
    List<RecommendedColor> colors,
    FormalityRange formalityRange,
    Set<String> aesthetics,
    List<String> suggestedL2,
    String example
) {

    public CategoryRecommendation {
        colors = List.copyOf(colors);
        aesthetics = Collections.unmodifiableSet(new LinkedHashSet<>(aesthetics));
        suggestedL2 = List.copyOf(suggestedL2);
    }
}
