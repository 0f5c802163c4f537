package com.jay.insight.layer2_analysis;

import com.jay.insight.model.HealthBadge;
import com.jay.insight.model.HealthComponent;
import com.jay.insight.model.enums.AltmanZone;
import com.jay.insight.model.enums.HealthTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Layer 2 — Composite Health Scorer.
 * Blends four independently scaled signals into a 0-100 score:
 *
 *   Piotroski F-Score (0-9)          → 0-30, linear
 *   Altman Z-Score                   → 30 safe / 15 grey / 0 distress
 *   Financial health factor (0-100)  → 0-25, linear
 *   Debt/Equity percentile (0-100)   → 0-15, linear (already higher = better)
 *
 * Absent signals contribute nothing, so fewer inputs lower the reachable ceiling.
 */
@Slf4j
@Component
public class HealthScorer {

    static final double PIOTROSKI_MAX = 9;
    static final double PIOTROSKI_POINTS = 30;
    static final double ALTMAN_SAFE_POINTS = 30;
    static final double ALTMAN_GREY_POINTS = 15;
    static final double HEALTH_FACTOR_POINTS = 25;
    static final double DEBT_PERCENTILE_POINTS = 15;

    /** Signals feeding the badge; every field may be null. */
    public record HealthSignals(Integer piotroskiScore, Double altmanZScore,
                                Double financialHealthScore, Double debtPercentile) {}

    public record HealthScore(HealthTier badge, double score) {}

    public HealthScore score(HealthSignals signals) {
        double score = 0;

        if (signals.piotroskiScore() != null) {
            score += signals.piotroskiScore() / PIOTROSKI_MAX * PIOTROSKI_POINTS;
        }

        if (isFinite(signals.altmanZScore())) {
            switch (AltmanZone.of(signals.altmanZScore())) {
                case SAFE -> score += ALTMAN_SAFE_POINTS;
                case GREY -> score += ALTMAN_GREY_POINTS;
                case DISTRESS -> { }
            }
        }

        if (isFinite(signals.financialHealthScore())) {
            score += signals.financialHealthScore() / 100.0 * HEALTH_FACTOR_POINTS;
        }

        if (isFinite(signals.debtPercentile())) {
            score += signals.debtPercentile() / 100.0 * DEBT_PERCENTILE_POINTS;
        }

        return new HealthScore(HealthTier.forScore(score), score);
    }

    /** Badge, score rounded to one decimal, and one component per signal present. */
    public HealthBadge assess(HealthSignals signals) {
        HealthScore hs = score(signals);
        log.debug("Health score {} → {}", hs.score(), hs.badge());
        return HealthBadge.builder()
            .badge(hs.badge())
            .score(Math.round(hs.score() * 10) / 10.0)
            .components(components(signals))
            .build();
    }

    Map<String, HealthComponent> components(HealthSignals signals) {
        Map<String, HealthComponent> components = new LinkedHashMap<>();

        Integer f = signals.piotroskiScore();
        if (f != null) {
            String interp = f >= 7 ? "Strong" : f <= 3 ? "Weak" : "Moderate";
            components.put("piotroski_f_score", HealthComponent.builder()
                .value(f).max(PIOTROSKI_MAX).interpretation(interp).build());
        }

        Double z = signals.altmanZScore();
        if (isFinite(z)) {
            AltmanZone zone = AltmanZone.of(z);
            components.put("altman_z_score", HealthComponent.builder()
                .value(z).zone(zone).interpretation(zone.interpretation()).build());
        }

        Double health = signals.financialHealthScore();
        if (isFinite(health)) {
            components.put("financial_health", HealthComponent.builder()
                .value(health).max(100.0).interpretation(String.format("%.0f/100", health)).build());
        }

        Double dePct = signals.debtPercentile();
        if (isFinite(dePct)) {
            String interp = dePct >= 80 ? "Low leverage" : dePct <= 20 ? "High leverage" : "Moderate leverage";
            components.put("debt_percentile", HealthComponent.builder()
                .value(Math.round(dePct)).interpretation(interp).build());
        }
        return components;
    }

    private static boolean isFinite(Double v) {
        return v != null && Double.isFinite(v);
    }
}
