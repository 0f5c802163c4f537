package com.jay.insight.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Qualitative trust in a valuation model's estimate. */
public enum Confidence {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
