package com.siy.style.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

public record FormalityRangePayload(
    @NotNull @DecimalMin("1.0") @DecimalMax("5.0")
    Double min,

    @NotNull @DecimalMin("1.0") @DecimalMax("5.0")
    Double max
) {
}
