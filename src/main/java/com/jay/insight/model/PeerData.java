package com.jay.insight.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class PeerData {
    private String ticker;
    private String companyName;
    private Double compositeScore;
    private String industry;
    private PeerMetrics metrics;
}
