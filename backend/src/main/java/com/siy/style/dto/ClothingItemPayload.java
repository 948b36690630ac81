package com.siy.style.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record ClothingItemPayload(
    @NotNull @Valid
    ColorPayload color,

    @NotNull @Valid
    CategoryPayload category,

    @NotNull @DecimalMin("1.0") @DecimalMax("5.0")
    Double formality,

    List<String> aesthetics
) {
}
