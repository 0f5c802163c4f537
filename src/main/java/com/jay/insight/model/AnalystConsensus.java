package com.jay.insight.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AnalystConsensus {
    private Double targetPrice;
    private Double upsidePercent;
    private Integer numAnalysts;
}
