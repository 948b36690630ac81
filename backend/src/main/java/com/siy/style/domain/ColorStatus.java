package com.siy.style.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ColorStatus {

    OK("ok"),
    WARNING("warning");

    private final String label;

    ColorStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public ColorStatus worse(ColorStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
