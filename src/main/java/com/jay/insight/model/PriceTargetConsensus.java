package com.jay.insight.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceTargetConsensus {
    private String ticker;
    private Double targetConsensus;
    private Double targetHigh;
    private Double targetLow;
    private Integer numAnalysts;
}
