package com.jay.insight.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** The handful of metrics shown side by side in a peer comparison. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PeerMetrics {
    private Double peRatio;
    private Double roe;
    private Double revenueGrowthYoy;
    private Double netMargin;
    private Double debtToEquity;
    private Double marketCap;
}
