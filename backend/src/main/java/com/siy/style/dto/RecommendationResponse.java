package com.siy.style.dto;

import com.siy.style.domain.CategoryRecommendation;
import java.util.List;

public record RecommendationResponse(List<CategoryRecommendation> recommendations) {
}
