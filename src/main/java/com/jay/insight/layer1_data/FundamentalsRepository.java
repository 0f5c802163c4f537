package com.jay.insight.layer1_data;

import com.jay.insight.model.CompositeScore;
import com.jay.insight.model.FairValueInputs;
import com.jay.insight.model.LifecycleClassification;
import com.jay.insight.model.MetricDataPoint;
import com.jay.insight.model.MetricDistribution;
import com.jay.insight.model.PeerCandidate;
import com.jay.insight.model.StockMetrics;
import com.jay.insight.model.StockReference;
import com.jay.insight.model.enums.PeerGroup;
import com.jay.insight.model.enums.Timeframe;

import java.util.List;
import java.util.Optional;

/**
 * Layer 1 — stored fundamentals.
 * Read-only access to reference data, precomputed sector distributions and
 * per-stock metric snapshots. Implementations throw {@link UpstreamDataException}
 * when the store itself fails; "no row" is an empty result, never an exception.
 */
public interface FundamentalsRepository {

    Optional<StockReference> findStock(String ticker);

    List<MetricDistribution> findSectorDistributions(String sector);

    Optional<StockMetrics> findMetrics(String ticker);

    Optional<CompositeScore> findLatestCompositeScore(String ticker);

    Optional<LifecycleClassification> findLifecycle(String ticker);

    Optional<FairValueInputs> findFairValueInputs(String ticker);

    /** Newest period first, at most {@code limit} points. */
    List<MetricDataPoint> findMetricHistory(String ticker, String metric, Timeframe timeframe, int limit);

    /**
     * Stocks in the same industry or sector whose market cap lies within
     * 0.25x to 4x of {@code marketCap}, closest in size first. The excluded
     * ticker is matched case-insensitively.
     */
    List<PeerCandidate> findPeers(PeerGroup group, String groupName, double marketCap,
                                  String excludeTicker, int limit);
}
