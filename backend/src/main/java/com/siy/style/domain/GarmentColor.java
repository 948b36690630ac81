package com.siy.style.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A garment color. {@code hex} is canonical ("#RRGGBB", upper case); {@code hsl} and
 * {@code neutral} are derived from it by {@link com.siy.style.engine.ColorModel}, which is
 * the only place instances should be created.
 */
public record GarmentColor(
    String hex,
    Hsl hsl,
    String name,
    @JsonProperty("is_neutral") boolean neutral
) {
}
