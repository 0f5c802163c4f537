package com.jay.insight.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Altman Z-Score bands: above 2.99 safe, below 1.81 distress, grey in between. */
public enum AltmanZone {
    SAFE("Healthy"),
    GREY("Grey zone"),
    DISTRESS("Distress zone");

    public static final double SAFE_THRESHOLD = 2.99;
    public static final double DISTRESS_THRESHOLD = 1.81;

    private final String interpretation;

    AltmanZone(String interpretation) {
        this.interpretation = interpretation;
    }

    public static AltmanZone of(double zScore) {
        if (zScore > SAFE_THRESHOLD) return SAFE;
        if (zScore < DISTRESS_THRESHOLD) return DISTRESS;
        return GREY;
    }

    public String interpretation() {
        return interpretation;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
