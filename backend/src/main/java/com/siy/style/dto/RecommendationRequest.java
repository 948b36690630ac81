package com.siy.style.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record RecommendationRequest(
    @NotNull @Valid
    ColorPayload baseColor,

    @NotNull @DecimalMin("1.0") @DecimalMax("5.0")
    Double baseFormality,

    List<String> baseAesthetics,

    @NotNull @Valid
    CategoryPayload baseCategory,

    List<String> categories
) {
}
