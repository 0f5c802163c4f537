package com.jay.insight.model;

import com.jay.insight.model.enums.ValuationZone;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class MarginOfSafety {
    private Double avgFairValue;
    private Double deviationPercent;   // (avgFairValue - price) / price * 100
    private ValuationZone zone;
    private String description;
}
