package com.siy.style.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PairingStatus {

    OK("ok"),
    WARNING("warning");

    private final String label;

    PairingStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public PairingStatus worse(PairingStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
