package com.jay.insight.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
