package com.siy.style.service;

import com.siy.style.domain.Category;
import com.siy.style.domain.CategoryL1;
import com.siy.style.domain.ClothingAttributes;
import com.siy.style.domain.FormalityRange;
import com.siy.style.domain.GarmentColor;
import com.siy.style.domain.HarmonyType;
import com.siy.style.domain.MatchCriteria;
import com.siy.style.domain.RecommendedColor;
import com.siy.style.dto.CategoryPayload;
import com.siy.style.dto.ClothingItemPayload;
import com.siy.style.dto.ColorPayload;
import com.siy.style.dto.MatchingItemsRequest;
import com.siy.style.dto.RecommendationRequest;
import com.siy.style.engine.ColorModel;
import java.util.LinkedHashSet;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Turns request payloads into engine types. Closed-set labels are resolved here so an
 * unknown value fails the request instead of being coerced.
 */
@Component
public class StyleRequestMapper {

    private final ColorModel colorModel;

    public StyleRequestMapper(ColorModel colorModel) {
        this.colorModel = colorModel;
    }

    public GarmentColor toColor(ColorPayload payload) {
        return colorModel.fromHex(payload.hex(), payload.name());
    }

    public Category toCategory(CategoryPayload payload) {
        return new Category(CategoryL1.fromLabel(payload.l1()), payload.l2());
    }

    public ClothingAttributes toAttributes(ClothingItemPayload payload) {
        return new ClothingAttributes(
            toColor(payload.color()),
            toCategory(payload.category()),
            payload.formality(),
            payload.aesthetics() == null ? null : new LinkedHashSet<>(payload.aesthetics())
        );
    }

    public List<ClothingAttributes> toAttributes(List<ClothingItemPayload> payloads) {
        if (payloads == null) {
            return List.of();
        }
        return payloads.stream().map(this::toAttributes).toList();
    }

    public ClothingAttributes toBaseAttributes(RecommendationRequest request) {
        return new ClothingAttributes(
            toColor(request.baseColor()),
            toCategory(request.baseCategory()),
            request.baseFormality(),
            request.baseAesthetics() == null ? null : new LinkedHashSet<>(request.baseAesthetics())
        );
    }

    public List<CategoryL1> toCategories(List<String> labels) {
        if (labels == null) {
            return List.of();
        }
        return labels.stream().map(CategoryL1::fromLabel).toList();
    }

    public MatchCriteria toCriteria(MatchingItemsRequest request) {
        List<RecommendedColor> colors = request.recommendedColors().stream()
            .map(color -> new RecommendedColor(
                colorModel.normalizeHex(color.hex()),
                color.name(),
                HarmonyType.fromLabel(color.harmonyType())
            ))
            .toList();

        return new MatchCriteria(
            CategoryL1.fromLabel(request.categoryL1()),
            colors,
            new FormalityRange(request.formalityRange().min(), request.formalityRange().max())
        );
    }
}
