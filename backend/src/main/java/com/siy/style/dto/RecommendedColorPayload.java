package com.siy.style.dto;

import jakarta.validation.constraints.NotBlank;

public record RecommendedColorPayload(
    @NotBlank
    String hex,

    String name,

    @NotBlank
    String harmonyType
) {
}
