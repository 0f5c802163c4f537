package com.jay.insight.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Precomputed distribution of one metric across a sector.
 * Any breakpoint may be null; null means "not computed", never zero.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricDistribution {
    private String sector;
    private String metricName;
    private LocalDate calculatedAt;

    // Breakpoints, expected non-decreasing in this order
    private Double min;
    private Double p10;
    private Double p25;
    private Double p50;   // median
    private Double p75;
    private Double p90;
    private Double max;

    private Double mean;
    private Double stdDev;
    private Integer sampleCount;

    /** Direction comes from the static metric table, not from upstream data. */
    public boolean lowerIsBetter() {
        return MetricCatalog.isLowerBetter(metricName);
    }
}
