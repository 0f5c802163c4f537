package com.jay.insight.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse indicator of how many upstream sources answered a health request.
 * Every source counts the same regardless of its importance.
 */
public enum DataQuality {
    FULL,
    PARTIAL,
    INSUFFICIENT;

    public static DataQuality fromSourceCount(int sourcesAvailable) {
        if (sourcesAvailable == 0) return INSUFFICIENT;
        if (sourcesAvailable <= 2) return PARTIAL;
        return FULL;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
