package com.jay.insight.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A stock eligible for peer comparison, already joined with its latest
 * composite score and headline metrics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PeerCandidate {
    private String symbol;
    private String name;
    private String sector;
    private String industry;
    private Double marketCap;
    private Double compositeScore;   // null = never scored
    private PeerMetrics metrics;
}
