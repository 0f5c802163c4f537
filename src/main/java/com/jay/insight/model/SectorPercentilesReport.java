package com.jay.insight.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.util.Map;

@Data
@Builder
public class SectorPercentilesReport {
    private String ticker;
    private String sector;
    private LocalDate calculatedAt;
    private Integer sampleCount;
    private Map<String, MetricPercentile> metrics;
}
