package com.jay.insight.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ValuationZone {
    UNDERVALUED,    // average fair value more than 15% above price
    FAIRLY_VALUED,  // within ±15%
    OVERVALUED;     // average fair value more than 15% below price

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
