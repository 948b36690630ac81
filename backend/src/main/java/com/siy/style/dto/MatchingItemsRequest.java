package com.siy.style.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record MatchingItemsRequest(
    @NotBlank
    String categoryL1,

    @NotNull
    List<@NotNull @Valid RecommendedColorPayload> recommendedColors,

    @NotNull @Valid
    FormalityRangePayload formalityRange,

    @Min(1) @Max(10)
    Integer limit
) {
}
