package com.jay.insight.layer2_analysis;

import com.jay.insight.model.MetricDataPoint;
import com.jay.insight.model.MetricTrend;
import com.jay.insight.model.enums.Timeframe;
import com.jay.insight.model.enums.TrendDirection;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TrendAnalyzerTest {

    private final TrendAnalyzer analyzer = new TrendAnalyzer();

    /** Newest first. */
    private static List<MetricDataPoint> series(Double... values) {
        List<MetricDataPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(MetricDataPoint.builder().fiscalYear(2024 - i).value(values[i]).build());
        }
        return points;
    }

    @Test
    void steadyGrowthCountsEveryPair() {
        MetricTrend trend = analyzer.analyse(series(10.0, 9.0, 8.0, 7.0));

        assertThat(trend.getDirection()).isEqualTo(TrendDirection.UP);
        assertThat(trend.getConsecutiveGrowthPeriods()).isEqualTo(3);
        // (10 - 7) / 3 / 7
        assertThat(trend.getSlope()).isCloseTo(1.0 / 7, within(1e-12));
    }

    @Test
    void streakStopsAtFirstNonIncreasingPair() {
        MetricTrend trend = analyzer.analyse(series(10.0, 9.0, 11.0, 7.0));

        assertThat(trend.getConsecutiveGrowthPeriods()).isEqualTo(1);
        assertThat(trend.getDirection()).isEqualTo(TrendDirection.UP);
    }

    @Test
    void directionComesFromTwoNewestPointsOnly() {
        assertThat(analyzer.analyse(series(5.0, 6.0, 1.0, 0.5)).getDirection()).isEqualTo(TrendDirection.DOWN);
        assertThat(analyzer.analyse(series(5.0, 5.0, 1.0)).getDirection()).isEqualTo(TrendDirection.FLAT);
        assertThat(analyzer.analyse(series(5.0, 5.0, 1.0)).getConsecutiveGrowthPeriods()).isZero();
    }

    @Test
    void fewerThanTwoPointsHasNoTrend() {
        assertThat(analyzer.analyse(series(4.0))).isNull();
        assertThat(analyzer.analyse(List.of())).isNull();
        assertThat(analyzer.analyse(null)).isNull();
    }

    @Test
    void slopeOmittedWhenOldestIsNegligible() {
        assertThat(analyzer.analyse(series(3.0, 1.0, 0.0)).getSlope()).isNull();
        assertThat(analyzer.analyse(series(3.0, 1.0, 1e-11)).getSlope()).isNull();
        assertThat(analyzer.analyse(series(3.0, 1.0, -2.0)).getSlope()).isCloseTo(1.25, within(1e-12));
    }

    @Test
    void missingValuesDegradeInsteadOfFailing() {
        MetricTrend trend = analyzer.analyse(series(null, 9.0, 8.0));
        assertThat(trend.getDirection()).isEqualTo(TrendDirection.FLAT);
        assertThat(trend.getConsecutiveGrowthPeriods()).isZero();
        assertThat(trend.getSlope()).isNull();

        MetricTrend gap = analyzer.analyse(series(10.0, 9.0, null, 7.0));
        assertThat(gap.getConsecutiveGrowthPeriods()).isEqualTo(1);
        assertThat(gap.getSlope()).isNotNull();
    }

    @Test
    void quarterlyYoyLooksFourPeriodsBack() {
        List<MetricDataPoint> points = analyzer.withYoyChanges(
            series(120.0, 110.0, 105.0, 101.0, 100.0, 95.0), Timeframe.QUARTERLY);

        assertThat(points.get(0).getYoyChange()).isCloseTo(0.20, within(1e-12));
        assertThat(points.get(1).getYoyChange()).isCloseTo(110.0 / 95 - 1, within(1e-12));
        assertThat(points.get(2).getYoyChange()).isNull();
        assertThat(points.get(5).getYoyChange()).isNull();
    }

    @Test
    void annualYoyLooksOnePeriodBackAndUsesAbsoluteBase() {
        List<MetricDataPoint> points = analyzer.withYoyChanges(series(-5.0, -10.0, 0.0), Timeframe.ANNUAL);

        assertThat(points.get(0).getYoyChange()).isCloseTo(0.5, within(1e-12));
        assertThat(points.get(1).getYoyChange()).isNull();
        assertThat(points.get(2).getYoyChange()).isNull();
    }

    @Test
    void yoyLeavesInputSeriesUntouched() {
        List<MetricDataPoint> input = series(2.0, 1.0);

        List<MetricDataPoint> output = analyzer.withYoyChanges(input, Timeframe.ANNUAL);

        assertThat(input.get(0).getYoyChange()).isNull();
        assertThat(output.get(0).getYoyChange()).isCloseTo(1.0, within(1e-12));
        assertThat(output.get(0).getFiscalYear()).isEqualTo(2024);
    }
}
