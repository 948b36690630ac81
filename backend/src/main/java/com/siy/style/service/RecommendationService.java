package com.siy.style.service;

import com.siy.style.domain.CategoryL1;
import com.siy.style.domain.CategoryRecommendation;
import com.siy.style.domain.ClothingAttributes;
import com.siy.style.dto.RecommendationRequest;
import com.siy.style.dto.RecommendationResponse;
import com.siy.style.engine.RecommendationGenerator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class RecommendationService {

    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    private final StyleRequestMapper requestMapper;
    private final RecommendationGenerator recommendationGenerator;

    public RecommendationService(StyleRequestMapper requestMapper, RecommendationGenerator recommendationGenerator) {
        this.requestMapper = requestMapper;
        this.recommendationGenerator = recommendationGenerator;
    }

    public RecommendationResponse recommend(RecommendationRequest request) {
        ClothingAttributes base = requestMapper.toBaseAttributes(request);
        List<CategoryL1> targets = requestMapper.toCategories(request.categories());

        List<CategoryRecommendation> recommendations = recommendationGenerator.generate(base, targets);
        log.debug(
            "Generated {} recommendations (baseCategory={}, baseColor={}, formality={})",
            recommendations.size(),
            base.l1().label(),
            base.color().hex(),
            base.formality()
        );
        return new RecommendationResponse(recommendations);
    }
}
