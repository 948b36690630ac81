package com.siy.style.dto;

import jakarta.validation.constraints.NotBlank;

public record CategoryPayload(
    @NotBlank
    String l1,

    String l2
) {
}
