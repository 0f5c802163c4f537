package com.jay.insight.model;

import com.jay.insight.model.enums.TrendDirection;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class MetricTrend {
    private TrendDirection direction;
    private Double slope;                 // null when the oldest value is ~0 or missing
    private int consecutiveGrowthPeriods;
}
