package com.jay.insight.model;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class FairValueReport {
    private String ticker;
    private Double currentPrice;
    private Map<String, FairValueModel> models;
    private AnalystConsensus analystConsensus;
    private MarginOfSafety marginOfSafety;      // null = no verdict
    private boolean suppressed;
    private String suppressionReason;
}
