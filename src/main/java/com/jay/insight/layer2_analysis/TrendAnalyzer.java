package com.jay.insight.layer2_analysis;

import com.jay.insight.model.MetricDataPoint;
import com.jay.insight.model.MetricTrend;
import com.jay.insight.model.enums.Timeframe;
import com.jay.insight.model.enums.TrendDirection;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 2 — Trend Analyzer.
 * Summarises a newest-first metric series: direction of the latest move,
 * how many periods in a row the metric has grown, and a slope normalised
 * by the oldest value. Also derives year-over-year changes per point.
 * Series are never modified.
 */
@Component
public class TrendAnalyzer {

    /** Divisors at or below this magnitude are treated as zero. */
    static final double EPSILON = 1e-10;

    /**
     * Trend for a newest-first series, or null with fewer than two points.
     */
    public MetricTrend analyse(List<MetricDataPoint> series) {
        if (series == null || series.size() < 2) return null;

        // Direction only looks at the two newest points
        Double latest = series.get(0).getValue();
        Double previous = series.get(1).getValue();
        TrendDirection direction = TrendDirection.FLAT;
        if (latest != null && previous != null) {
            if (latest > previous) direction = TrendDirection.UP;
            else if (latest < previous) direction = TrendDirection.DOWN;
        }

        // Unbroken run of growth starting at the newest point
        int consecutive = 0;
        for (int i = 0; i < series.size() - 1; i++) {
            Double cur = series.get(i).getValue();
            Double older = series.get(i + 1).getValue();
            if (cur != null && older != null && cur > older) {
                consecutive++;
            } else {
                break;
            }
        }

        Double slope = null;
        Double oldest = series.get(series.size() - 1).getValue();
        if (latest != null && oldest != null && Math.abs(oldest) > EPSILON) {
            double s = (latest - oldest) / (series.size() - 1) / Math.abs(oldest);
            if (Double.isFinite(s)) slope = s;
        }

        return MetricTrend.builder()
            .direction(direction)
            .slope(slope)
            .consecutiveGrowthPeriods(consecutive)
            .build();
    }

    /**
     * Copies of the points with {@code yoyChange} set to
     * (value - value[i + lookback]) / |value[i + lookback]|. Points without a
     * far enough predecessor, or with a missing or ~0 base, keep a null change.
     */
    public List<MetricDataPoint> withYoyChanges(List<MetricDataPoint> series, Timeframe timeframe) {
        if (series == null) return List.of();
        int lookback = timeframe.yoyLookback();

        List<MetricDataPoint> result = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            MetricDataPoint point = series.get(i);
            Double change = null;
            if (i + lookback < series.size()) {
                Double cur = point.getValue();
                Double prev = series.get(i + lookback).getValue();
                if (cur != null && prev != null && Math.abs(prev) > EPSILON) {
                    change = (cur - prev) / Math.abs(prev);
                }
            }
            result.add(point.toBuilder().yoyChange(change).build());
        }
        return result;
    }
}
