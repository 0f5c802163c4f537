package com.jay.insight.model;

import com.jay.insight.model.enums.Timeframe;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class MetricHistoryReport {
    private String ticker;
    private String metric;
    private Timeframe timeframe;
    private String unit;
    private List<MetricDataPoint> dataPoints;
    private MetricTrend trend;   // null when fewer than two points
}
