package com.jay.insight.layer2_analysis;

import com.jay.insight.model.MetricDistribution;
import com.jay.insight.model.StockMetrics;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Layer 2 — Percentile Distribution Resolver.
 * Places a raw metric value inside its sector distribution by piecewise linear
 * interpolation between the breakpoints (min, p10, p25, p50, p75, p90, max).
 * Results are direction-corrected: for lower-is-better metrics the
 * interpolated rank is inverted so that a higher percentile is always better.
 *
 * Pure computation; never touches storage.
 */
@Component
public class PercentileResolver {

    private static final double[] ANCHOR_PERCENTILES = {0, 10, 25, 50, 75, 90, 100};

    private record Anchor(double value, double percentile) {}

    /**
     * Returns the direction-corrected percentile (0-100, one decimal) of
     * {@code value}, or null when the value is missing or not finite, or
     * the distribution carries no breakpoints at all.
     */
    public Double percentile(MetricDistribution distribution, Double value) {
        if (distribution == null || value == null || !Double.isFinite(value)) return null;

        Double raw = rawPercentile(distribution, value);
        if (raw == null) return null;

        double pct = round1(raw);
        return distribution.lowerIsBetter() ? round1(100 - pct) : pct;
    }

    private static double round1(double v) {
        return Math.round(v * 10) / 10.0;
    }

    /**
     * Interpolated rank before direction correction. Absent breakpoints are
     * skipped, so bracketing happens between the nearest breakpoints that
     * exist. Out-of-order breakpoints are tolerated: the first bracketing pair
     * in documented order wins and the result is clamped to 0-100.
     */
    Double rawPercentile(MetricDistribution d, double value) {
        List<Anchor> anchors = anchors(d);
        if (anchors.isEmpty()) return null;

        if (d.getMin() != null && value <= d.getMin()) return 0.0;
        if (d.getMax() != null && value >= d.getMax()) return 100.0;

        Anchor first = anchors.get(0);
        if (value <= first.value()) {
            // Below the lowest known breakpoint and no min to anchor 0
            return first.percentile();
        }
        for (int i = 1; i < anchors.size(); i++) {
            Anchor lo = anchors.get(i - 1);
            Anchor hi = anchors.get(i);
            if (value <= hi.value()) {
                return clamp(interpolate(value, lo, hi));
            }
        }
        // Above the highest known breakpoint and no max to anchor 100
        return anchors.get(anchors.size() - 1).percentile();
    }

    /**
     * Direction-corrected percentiles for every metric that has both a value
     * and a distribution. Metrics missing either side are simply absent.
     */
    public Map<String, Double> percentiles(StockMetrics metrics, Collection<MetricDistribution> distributions) {
        Map<String, Double> result = new HashMap<>();
        if (metrics == null || distributions == null) return result;

        for (MetricDistribution d : distributions) {
            if (d == null || d.getMetricName() == null) continue;
            Double pct = percentile(d, metrics.value(d.getMetricName()));
            if (pct != null) result.put(d.getMetricName(), pct);
        }
        return result;
    }

    private static List<Anchor> anchors(MetricDistribution d) {
        Double[] breakpoints = {d.getMin(), d.getP10(), d.getP25(), d.getP50(), d.getP75(), d.getP90(), d.getMax()};
        List<Anchor> anchors = new ArrayList<>(breakpoints.length);
        for (int i = 0; i < breakpoints.length; i++) {
            Double bp = breakpoints[i];
            if (bp != null && Double.isFinite(bp)) anchors.add(new Anchor(bp, ANCHOR_PERCENTILES[i]));
        }
        return anchors;
    }

    private static double interpolate(double value, Anchor lo, Anchor hi) {
        if (hi.value() == lo.value()) return lo.percentile();
        double ratio = (value - lo.value()) / (hi.value() - lo.value());
        return lo.percentile() + ratio * (hi.percentile() - lo.percentile());
    }

    private static double clamp(double pct) {
        return Math.max(0, Math.min(100, pct));
    }
}
