package com.siy.style.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record OutfitValidation(
    @JsonProperty("is_complete") boolean complete,
    int cohesionScore,
    String verdict,
    ColorStatus colorStatus,
    FormalityStatus formalityStatus,
    AestheticStatus aestheticStatus,
    PairingStatus pairingStatus,
    List<String> warnings,
    List<String> colorStrip,
    List<CategoryL1> missingCategories
) {

    public OutfitValidation {
        warnings = List.copyOf(warnings);
        colorStrip = List.copyOf(colorStrip);
        missingCategories = List.copyOf(missingCategories);
    }
}
