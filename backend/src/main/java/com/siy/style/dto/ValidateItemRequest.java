package com.siy.style.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record ValidateItemRequest(
    @NotNull @Valid
    ClothingItemPayload newItem,

    @NotNull @Valid
    ClothingItemPayload baseItem,

    List<@NotNull @Valid ClothingItemPayload> currentOutfit
) {
}
