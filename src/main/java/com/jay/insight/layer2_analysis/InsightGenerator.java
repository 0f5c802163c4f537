package com.jay.insight.layer2_analysis;

import com.jay.insight.config.InsightConfig;
import com.jay.insight.model.MetricCatalog;
import com.jay.insight.model.RedFlag;
import com.jay.insight.model.StrengthConcern;
import com.jay.insight.model.enums.AltmanZone;
import com.jay.insight.model.enums.Severity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.DoublePredicate;

/**
 * Layer 2 — Insight Generator.
 * Turns sector percentiles into ranked strengths and concerns, and runs the
 * fixed red-flag rules over the raw scores and metrics.
 *
 * Percentiles are expected direction-corrected (higher = better). Strengths
 * take the top band (≥ 75), concerns the bottom band (≤ 25); a metric in
 * between produces neither. Inputs are never modified.
 */
@Component
@RequiredArgsConstructor
public class InsightGenerator {

    static final double STRENGTH_FLOOR = 75;
    static final double CONCERN_CEILING = 25;

    static final int WEAK_PIOTROSKI_MAX = 3;
    static final double MAX_SUSTAINABLE_PAYOUT_PCT = 100;
    static final double HIGH_LEVERAGE_PERCENTILE = 10;
    static final double MIN_INTEREST_COVERAGE = 2;

    private final InsightConfig config;

    public record Insights(List<StrengthConcern> strengths, List<StrengthConcern> concerns, List<RedFlag> redFlags) {}

    /** Everything the health summary needs, using the configured list sizes. */
    public Insights generate(Map<String, Double> metrics, Map<String, Double> percentiles, String sector,
                             Integer piotroskiScore, Double altmanZScore) {
        InsightConfig.Insights cfg = config.insights();
        return new Insights(
            strengths(metrics, percentiles, sector, cfg.getMaxStrengths()),
            concerns(metrics, percentiles, sector, cfg.getMaxConcerns()),
            redFlags(metrics, piotroskiScore, altmanZScore, percentiles));
    }

    // ── Strengths & Concerns ──────────────────────────────────────────────────

    public List<StrengthConcern> strengths(Map<String, Double> metrics, Map<String, Double> percentiles,
                                           String sector, int limit) {
        List<Map.Entry<String, Double>> candidates = candidates(percentiles, pct -> pct >= STRENGTH_FLOOR);
        candidates.sort(Map.Entry.<String, Double>comparingByValue().reversed()
            .thenComparing(Map.Entry.<String, Double>comparingByKey()));

        return candidates.stream()
            .limit(Math.max(0, limit))
            .map(c -> StrengthConcern.builder()
                .metric(c.getKey())
                .value(valueOf(metrics, c.getKey()))
                .percentile(c.getValue())
                .message(String.format("%s ranks in top %.0f%% of %s sector",
                    MetricCatalog.displayName(c.getKey()), 100 - c.getValue(), sector))
                .build())
            .toList();
    }

    public List<StrengthConcern> concerns(Map<String, Double> metrics, Map<String, Double> percentiles,
                                          String sector, int limit) {
        List<Map.Entry<String, Double>> candidates = candidates(percentiles, pct -> pct <= CONCERN_CEILING);
        // Worst first
        candidates.sort(Map.Entry.<String, Double>comparingByValue()
            .thenComparing(Map.Entry.<String, Double>comparingByKey()));

        return candidates.stream()
            .limit(Math.max(0, limit))
            .map(c -> StrengthConcern.builder()
                .metric(c.getKey())
                .value(valueOf(metrics, c.getKey()))
                .percentile(c.getValue())
                .message(String.format("%s is below %.0f%% of %s sector peers",
                    MetricCatalog.displayName(c.getKey()), 100 - c.getValue(), sector))
                .build())
            .toList();
    }

    private static List<Map.Entry<String, Double>> candidates(Map<String, Double> percentiles,
                                                              DoublePredicate band) {
        List<Map.Entry<String, Double>> out = new ArrayList<>();
        if (percentiles == null) return out;
        percentiles.forEach((metric, pct) -> {
            if (pct != null && Double.isFinite(pct) && band.test(pct)) out.add(Map.entry(metric, pct));
        });
        return out;
    }

    // ── Red Flags ─────────────────────────────────────────────────────────────

    /**
     * Evaluates every rule independently. Never returns null; an empty list
     * means no rule fired.
     */
    public List<RedFlag> redFlags(Map<String, Double> metrics, Integer piotroskiScore, Double altmanZScore,
                                  Map<String, Double> percentiles) {
        List<RedFlag> flags = new ArrayList<>();

        if (altmanZScore != null && altmanZScore < AltmanZone.DISTRESS_THRESHOLD) {
            flags.add(RedFlag.builder()
                .id("altman_distress")
                .severity(Severity.HIGH)
                .title("Altman Z-Score indicates financial distress")
                .description(String.format("Z-Score of %.2f is below the %.2f distress threshold",
                    altmanZScore, AltmanZone.DISTRESS_THRESHOLD))
                .relatedMetrics(List.of("altman_z_score"))
                .build());
        }

        if (piotroskiScore != null && piotroskiScore <= WEAK_PIOTROSKI_MAX) {
            flags.add(RedFlag.builder()
                .id("weak_piotroski")
                .severity(Severity.MEDIUM)
                .title("Weak Piotroski F-Score")
                .description(String.format("F-Score of %d/9 suggests deteriorating fundamentals", piotroskiScore))
                .relatedMetrics(List.of("piotroski_f_score"))
                .build());
        }

        Double payout = valueOf(metrics, "payout_ratio");
        if (payout != null && payout > MAX_SUSTAINABLE_PAYOUT_PCT) {
            flags.add(RedFlag.builder()
                .id("unsustainable_dividend")
                .severity(Severity.HIGH)
                .title("Unsustainable dividend payout")
                .description(String.format("Payout ratio of %.1f%% exceeds 100%%, the dividend may not be sustainable",
                    payout))
                .relatedMetrics(List.of("payout_ratio", "dividend_yield"))
                .build());
        }

        // Both conditions must hold: bottom-decile leverage AND thin coverage
        Double debtToEquity = valueOf(metrics, "debt_to_equity");
        Double coverage = valueOf(metrics, "interest_coverage");
        Double dePct = percentiles == null ? null : percentiles.get("debt_to_equity");
        if (debtToEquity != null && coverage != null && dePct != null
                && dePct <= HIGH_LEVERAGE_PERCENTILE && coverage < MIN_INTEREST_COVERAGE) {
            flags.add(RedFlag.builder()
                .id("high_leverage")
                .severity(Severity.HIGH)
                .title("High leverage with low interest coverage")
                .description(String.format("Debt/Equity of %.2f with interest coverage of %.1fx",
                    debtToEquity, coverage))
                .relatedMetrics(List.of("debt_to_equity", "interest_coverage"))
                .build());
        }

        return flags;
    }

    private static Double valueOf(Map<String, Double> metrics, String metric) {
        return metrics == null ? null : metrics.get(metric);
    }
}
