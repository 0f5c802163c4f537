package com.jay.insight.model;

import lombok.Builder;
import lombok.Data;

/** A stock's position within one sector distribution. */
@Data
@Builder
public class MetricPercentile {
    private Double value;
    private Double percentile;   // null when the stock has no value for the metric
    private boolean lowerIsBetter;
    private Breakpoints distribution;
    private Integer sampleCount;

    public record Breakpoints(Double min, Double p10, Double p25, Double p50,
                              Double p75, Double p90, Double max) {
        public static Breakpoints of(MetricDistribution d) {
            return new Breakpoints(d.getMin(), d.getP10(), d.getP25(), d.getP50(),
                d.getP75(), d.getP90(), d.getMax());
        }
    }
}
