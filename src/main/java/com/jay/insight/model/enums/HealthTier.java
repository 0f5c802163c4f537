package com.jay.insight.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Composite health badge. Tiers are ordered best first; each tier applies
 * when the composite score is at or above its floor.
 */
public enum HealthTier {
    STRONG("Strong", 80),
    HEALTHY("Healthy", 65),
    FAIR("Fair", 45),
    WEAK("Weak", 25),
    DISTRESSED("Distressed", Double.NEGATIVE_INFINITY);

    private final String label;
    private final double floor;

    HealthTier(String label, double floor) {
        this.label = label;
        this.floor = floor;
    }

    public static HealthTier forScore(double score) {
        for (HealthTier tier : values()) {
            if (score >= tier.floor) return tier;
        }
        return DISTRESSED;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
