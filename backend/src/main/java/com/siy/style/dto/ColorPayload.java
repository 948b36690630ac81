package com.siy.style.dto;

import jakarta.validation.constraints.NotBlank;

public record ColorPayload(
    @NotBlank
    String hex,

    HslPayload hsl,

    String name,

    Boolean isNeutral
) {
}
