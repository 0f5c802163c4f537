package com.jay.insight.model;

import com.jay.insight.model.enums.AltmanZone;
import lombok.Builder;
import lombok.Data;

/**
 * One scored health signal. Integer-valued signals (Piotroski 7/9)
 * are carried as doubles so every component serialises the same way.
 */
@Data
@Builder
public class HealthComponent {
    private double value;
    private Double max;
    private AltmanZone zone;
    private String interpretation;
}
