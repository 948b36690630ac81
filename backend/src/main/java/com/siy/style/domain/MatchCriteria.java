package com.siy.style.domain;

import java.util.List;

public record MatchCriteria(
    CategoryL1 categoryL1,
    List<RecommendedColor> colors,
    FormalityRange formalityRange
) {

    public MatchCriteria {
        if (categoryL1 == null) {
            throw new StyleEngineException(StyleErrorCode.UNKNOWN_CATEGORY, "category_l1 is missing");
        }
        if (formalityRange == null) {
            throw new StyleEngineException(StyleErrorCode.OUT_OF_RANGE_VALUE, "formality range is missing");
        }
        colors = colors == null ? List.of() : List.copyOf(colors);
    }

    public static MatchCriteria from(CategoryRecommendation recommendation) {
        return new MatchCriteria(
            recommendation.categoryL1(),
            recommendation.colors(),
            recommendation.formalityRange()
        );
    }
}
