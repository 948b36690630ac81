package com.siy.style.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Constants are declared from least to most severe.
 */
public enum FormalityStatus {

    OK("ok"),
    WARNING("warning"),
    MISMATCH("mismatch");

    private final String label;

    FormalityStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public FormalityStatus worse(FormalityStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
