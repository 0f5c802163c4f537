package com.jay.insight.layer2_analysis;

import com.jay.insight.model.AnalystConsensus;
import com.jay.insight.model.FairValueInputs;
import com.jay.insight.model.FairValueModel;
import com.jay.insight.model.MarginOfSafety;
import com.jay.insight.model.PriceTargetConsensus;
import com.jay.insight.model.RatiosTtm;
import com.jay.insight.model.enums.Confidence;
import com.jay.insight.model.enums.ValuationZone;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Layer 2 — Fair-Value Aggregator.
 * Builds the per-model estimates that are available for a stock and reduces
 * them to a margin-of-safety verdict against the current price.
 */
@Component
public class FairValueAggregator {

    /** Deviation band (in %) inside which a stock counts as fairly valued. */
    static final double VALUATION_BAND_PCT = 15;

    public static final String DCF = "dcf";
    public static final String GRAHAM_NUMBER = "graham_number";
    public static final String EPV = "epv";

    /**
     * Models that could be built from the stored inputs, in presentation order.
     * The Graham number prefers the stored value and falls back to the vendor TTM figure.
     */
    public Map<String, FairValueModel> buildModels(FairValueInputs stored, RatiosTtm ratios, Double currentPrice) {
        Map<String, FairValueModel> models = new LinkedHashMap<>();

        if (stored != null && stored.getDcfFairValue() != null) {
            FairValueModel.FairValueModelBuilder dcf = FairValueModel.builder()
                .fairValue(stored.getDcfFairValue())
                .upsidePercent(upsidePercent(stored.getDcfFairValue(), currentPrice))
                .confidence(Confidence.MEDIUM);
            if (stored.getWacc() != null) dcf.inputs(Map.of("wacc", stored.getWacc()));
            models.put(DCF, dcf.build());
        }

        Double graham = stored != null ? stored.getGrahamNumber() : null;
        if (graham == null && ratios != null) graham = ratios.getGrahamNumberTtm();
        if (graham != null) {
            models.put(GRAHAM_NUMBER, FairValueModel.builder()
                .fairValue(graham)
                .upsidePercent(upsidePercent(graham, currentPrice))
                .confidence(Confidence.HIGH)
                .build());
        }

        if (stored != null && stored.getEpvFairValue() != null) {
            models.put(EPV, FairValueModel.builder()
                .fairValue(stored.getEpvFairValue())
                .upsidePercent(upsidePercent(stored.getEpvFairValue(), currentPrice))
                .confidence(Confidence.MEDIUM)
                .build());
        }
        return models;
    }

    public AnalystConsensus analystConsensus(PriceTargetConsensus target, Double currentPrice) {
        if (target == null || target.getTargetConsensus() == null) return null;
        return AnalystConsensus.builder()
            .targetPrice(target.getTargetConsensus())
            .upsidePercent(upsidePercent(target.getTargetConsensus(), currentPrice))
            .numAnalysts(target.getNumAnalysts())
            .build();
    }

    /**
     * Averages every model that produced a fair value and classifies the gap
     * to the current price. Returns null (no verdict) when there is no usable
     * price or no estimate at all.
     */
    public MarginOfSafety marginOfSafety(Map<String, FairValueModel> models, Double currentPrice) {
        if (!hasPrice(currentPrice) || models == null || models.isEmpty()) return null;

        double total = 0;
        int count = 0;
        for (FairValueModel m : models.values()) {
            if (m != null && m.getFairValue() != null && Double.isFinite(m.getFairValue())) {
                total += m.getFairValue();
                count++;
            }
        }
        if (count == 0) return null;

        double avgFairValue = total / count;
        double deviation = (avgFairValue - currentPrice) / currentPrice * 100;

        ValuationZone zone;
        String description;
        if (deviation > VALUATION_BAND_PCT) {
            zone = ValuationZone.UNDERVALUED;
            description = String.format(
                "Stock may be undervalued, trading %.1f%% below average fair value estimate", deviation);
        } else if (deviation < -VALUATION_BAND_PCT) {
            zone = ValuationZone.OVERVALUED;
            description = String.format(
                "Stock may be overvalued, trading %.1f%% above average fair value estimate", -deviation);
        } else {
            zone = ValuationZone.FAIRLY_VALUED;
            description = String.format(
                "Stock is trading within %.0f%% of average fair value estimate", VALUATION_BAND_PCT);
        }

        return MarginOfSafety.builder()
            .avgFairValue(avgFairValue)
            .deviationPercent(deviation)
            .zone(zone)
            .description(description)
            .build();
    }

    /** (estimate - price) / price * 100, or null when either side is unusable. */
    public Double upsidePercent(Double estimate, Double currentPrice) {
        if (estimate == null || !Double.isFinite(estimate) || !hasPrice(currentPrice)) return null;
        return (estimate - currentPrice) / currentPrice * 100;
    }

    private static boolean hasPrice(Double price) {
        return price != null && Double.isFinite(price) && price > 0;
    }
}
