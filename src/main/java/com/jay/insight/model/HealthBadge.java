package com.jay.insight.model;

import com.jay.insight.model.enums.HealthTier;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class HealthBadge {
    private HealthTier badge;
    private double score;
    private Map<String, HealthComponent> components;
}
