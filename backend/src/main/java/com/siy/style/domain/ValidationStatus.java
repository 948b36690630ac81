package com.siy.style.domain;

import java.util.List;

/**
 * Per-axis outcome of validating one item, with warnings in rule-evaluation order.
 */
public record ValidationStatus(
    ColorStatus colorStatus,
    FormalityStatus formalityStatus,
    AestheticStatus aestheticStatus,
    PairingStatus pairingStatus,
    List<String> warnings
) {

    public ValidationStatus {
        warnings = List.copyOf(warnings);
    }
}
