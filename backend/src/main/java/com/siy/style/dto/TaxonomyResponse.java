package com.siy.style.dto;

import java.util.List;
import java.util.Map;

public record TaxonomyResponse(
    List<CategoryTaxonomyResponse> categories,
    Map<Integer, String> formalityLevels,
    List<String> aestheticTags
) {
}
