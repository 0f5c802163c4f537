package com.jay.insight.layer1_data;

import com.jay.insight.model.PriceTargetConsensus;
import com.jay.insight.model.QualityScores;
import com.jay.insight.model.RatiosTtm;

import java.util.Optional;

/**
 * Layer 1 — third-party fundamentals vendor (quality scores, TTM ratios,
 * analyst targets). Every call is independent and may fail on its own.
 */
public interface ScoreProvider {

    Optional<QualityScores> fetchQualityScores(String ticker);

    Optional<RatiosTtm> fetchRatiosTtm(String ticker);

    Optional<PriceTargetConsensus> fetchPriceTargetConsensus(String ticker);
}
