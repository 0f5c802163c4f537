package com.jay.insight.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/** One period of a metric time series. Series are ordered newest first. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MetricDataPoint {
    private LocalDate periodEnd;
    private int fiscalYear;
    private Integer fiscalQuarter;   // null for annual periods
    private Double value;
    private Double yoyChange;        // fraction, e.g. 0.12 = +12%
}
