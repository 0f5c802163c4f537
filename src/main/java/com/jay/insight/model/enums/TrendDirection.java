package com.jay.insight.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendDirection {
    UP,
    DOWN,
    FLAT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
