package com.jay.insight.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum Timeframe {
    QUARTERLY(4),   // four quarters back = one year
    ANNUAL(1);

    private final int yoyLookback;

    Timeframe(int yoyLookback) {
        this.yoyLookback = yoyLookback;
    }

    public int yoyLookback() {
        return yoyLookback;
    }

    public static Optional<Timeframe> parse(String raw) {
        if (raw == null) return Optional.empty();
        for (Timeframe t : values()) {
            if (t.wireName().equals(raw.trim().toLowerCase())) return Optional.of(t);
        }
        return Optional.empty();
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
