package com.siy.style.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AestheticStatus {

    COHESIVE("cohesive"),
    WARNING("warning");

    private final String label;

    AestheticStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public AestheticStatus worse(AestheticStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
