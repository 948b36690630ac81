package com.siy.style.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record ValidateOutfitRequest(
    @NotNull
    List<@NotNull @Valid ClothingItemPayload> outfit,

    @NotNull @Valid
    ClothingItemPayload baseItem
) {
}
