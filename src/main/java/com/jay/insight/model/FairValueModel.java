package com.jay.insight.model;

import com.jay.insight.model.enums.Confidence;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/** One valuation model's estimate, built per request from whatever sources answered. */
@Data
@Builder
public class FairValueModel {
    private Double fairValue;
    private Double upsidePercent;
    private Confidence confidence;
    private Map<String, Object> inputs;
}
