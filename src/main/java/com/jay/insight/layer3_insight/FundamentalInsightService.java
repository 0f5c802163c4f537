package com.jay.insight.layer3_insight;

import com.jay.insight.config.InsightConfig;
import com.jay.insight.layer1_data.FundamentalsRepository;
import com.jay.insight.layer1_data.ScoreProvider;
import com.jay.insight.layer1_data.UpstreamDataException;
import com.jay.insight.layer2_analysis.FairValueAggregator;
import com.jay.insight.layer2_analysis.HealthScorer;
import com.jay.insight.layer2_analysis.InsightGenerator;
import com.jay.insight.layer2_analysis.PercentileResolver;
import com.jay.insight.layer2_analysis.TrendAnalyzer;
import com.jay.insight.model.CompositeScore;
import com.jay.insight.model.FairValueInputs;
import com.jay.insight.model.FairValueModel;
import com.jay.insight.model.FairValueReport;
import com.jay.insight.model.HealthSummaryReport;
import com.jay.insight.model.LifecycleClassification;
import com.jay.insight.model.LifecycleInfo;
import com.jay.insight.model.MetricCatalog;
import com.jay.insight.model.MetricDataPoint;
import com.jay.insight.model.MetricDistribution;
import com.jay.insight.model.MetricHistoryReport;
import com.jay.insight.model.MetricPercentile;
import com.jay.insight.model.PeerCandidate;
import com.jay.insight.model.PeerData;
import com.jay.insight.model.PeerMetrics;
import com.jay.insight.model.PeersReport;
import com.jay.insight.model.PriceTargetConsensus;
import com.jay.insight.model.QualityScores;
import com.jay.insight.model.RatiosTtm;
import com.jay.insight.model.SectorPercentilesReport;
import com.jay.insight.model.StockMetrics;
import com.jay.insight.model.StockReference;
import com.jay.insight.model.enums.DataQuality;
import com.jay.insight.model.enums.LifecycleStage;
import com.jay.insight.model.enums.PeerGroup;
import com.jay.insight.model.enums.Timeframe;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Layer 3 — Fundamental Insight Service.
 * Gathers the independent upstream inputs for a stock in parallel, then runs
 * the layer-2 engine over the snapshot to build each insight report.
 *
 * Used by the /api/stocks/{ticker}/... endpoints.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FundamentalInsightService {

    static final String INSUFFICIENT_FAIR_VALUE_DATA =
        "Insufficient financial data to compute fair value estimates";

    private final FundamentalsRepository repository;
    private final ScoreProvider scoreProvider;
    private final ParallelFetchCoordinator coordinator;
    private final PercentileResolver percentileResolver;
    private final HealthScorer healthScorer;
    private final FairValueAggregator fairValueAggregator;
    private final InsightGenerator insightGenerator;
    private final TrendAnalyzer trendAnalyzer;
    private final InsightConfig config;

    // ── Sector percentiles ────────────────────────────────────────────────────

    /**
     * Percentile of each tracked metric within the stock's sector.
     * An empty filter means every metric the sector has a distribution for.
     */
    public SectorPercentilesReport sectorPercentiles(String rawTicker, Set<String> metricFilter) {
        String ticker = normalise(rawTicker);
        StockReference stock = requireSector(ticker);

        FetchTask<List<MetricDistribution>> distributionsTask =
            FetchTask.required("sector distributions", () -> repository.findSectorDistributions(stock.getSector()));
        FetchTask<StockMetrics> metricsTask =
            FetchTask.optional("stock metrics", () -> repository.findMetrics(ticker).orElse(null));

        FetchResults results = coordinator.fetchAll(ticker, List.of(distributionsTask, metricsTask));
        List<MetricDistribution> distributions = results.list(distributionsTask);
        StockMetrics metrics = results.value(metricsTask);

        Map<String, MetricPercentile> byMetric = new LinkedHashMap<>();
        MetricDistribution first = null;
        for (MetricDistribution d : distributions) {
            if (metricFilter != null && !metricFilter.isEmpty() && !metricFilter.contains(d.getMetricName())) continue;
            if (first == null) first = d;

            Double value = metrics != null ? metrics.value(d.getMetricName()) : null;
            byMetric.put(d.getMetricName(), MetricPercentile.builder()
                .value(value)
                .percentile(percentileResolver.percentile(d, value))
                .lowerIsBetter(d.lowerIsBetter())
                .distribution(MetricPercentile.Breakpoints.of(d))
                .sampleCount(d.getSampleCount())
                .build());
        }

        log.info("Sector percentiles for {} ({}): {} metrics", ticker, stock.getSector(), byMetric.size());
        return SectorPercentilesReport.builder()
            .ticker(ticker)
            .sector(stock.getSector())
            .calculatedAt(first != null ? first.getCalculatedAt() : null)
            .sampleCount(first != null ? first.getSampleCount() : null)
            .metrics(byMetric)
            .build();
    }

    // ── Fair value ────────────────────────────────────────────────────────────

    public FairValueReport fairValue(String rawTicker) {
        String ticker = normalise(rawTicker);

        FetchTask<FairValueInputs> storedTask =
            FetchTask.optional("fair value metrics", () -> repository.findFairValueInputs(ticker).orElse(null));
        FetchTask<RatiosTtm> ratiosTask =
            FetchTask.optional("vendor TTM ratios", () -> scoreProvider.fetchRatiosTtm(ticker).orElse(null));
        FetchTask<PriceTargetConsensus> targetTask =
            FetchTask.optional("analyst price target", () -> scoreProvider.fetchPriceTargetConsensus(ticker).orElse(null));

        FetchResults results = coordinator.fetchAll(ticker, List.of(storedTask, ratiosTask, targetTask));
        FairValueInputs stored = results.value(storedTask);

        Double currentPrice = stored != null ? stored.getStockPrice() : null;
        Map<String, FairValueModel> models =
            fairValueAggregator.buildModels(stored, results.value(ratiosTask), currentPrice);
        boolean suppressed = models.isEmpty();

        log.info("Fair value for {}: {} models, suppressed={}", ticker, models.size(), suppressed);
        return FairValueReport.builder()
            .ticker(ticker)
            .currentPrice(currentPrice)
            .models(models)
            .analystConsensus(fairValueAggregator.analystConsensus(results.value(targetTask), currentPrice))
            .marginOfSafety(fairValueAggregator.marginOfSafety(models, currentPrice))
            .suppressed(suppressed)
            .suppressionReason(suppressed ? INSUFFICIENT_FAIR_VALUE_DATA : null)
            .build();
    }

    // ── Health summary ────────────────────────────────────────────────────────

    /**
     * Health badge, lifecycle, strengths, concerns and red flags from five
     * independent sources. Any of them may be missing; only an unknown stock
     * makes the summary unavailable.
     */
    public HealthSummaryReport healthSummary(String rawTicker) {
        String ticker = normalise(rawTicker);
        StockReference stock = repository.findStock(ticker)
            .orElseThrow(() -> new InsightUnavailableException(ticker, "Stock not found",
                String.format("No data available for %s", ticker)));

        FetchTask<CompositeScore> compositeTask =
            FetchTask.optional("composite score", () -> repository.findLatestCompositeScore(ticker).orElse(null));
        FetchTask<QualityScores> qualityTask =
            FetchTask.optional("quality scores", () -> scoreProvider.fetchQualityScores(ticker).orElse(null));
        FetchTask<LifecycleClassification> lifecycleTask =
            FetchTask.optional("lifecycle classification", () -> repository.findLifecycle(ticker).orElse(null));
        FetchTask<StockMetrics> metricsTask =
            FetchTask.optional("stock metrics", () -> repository.findMetrics(ticker).orElse(null));
        FetchTask<List<MetricDistribution>> distributionsTask =
            FetchTask.optional("sector distributions", () -> stock.hasSector()
                ? repository.findSectorDistributions(stock.getSector()) : List.of());

        FetchResults results = coordinator.fetchAll(ticker,
            List.of(compositeTask, qualityTask, lifecycleTask, metricsTask, distributionsTask));

        int sourcesAvailable = results.availableCount();
        DataQuality quality = DataQuality.fromSourceCount(sourcesAvailable);

        StockMetrics metrics = results.value(metricsTask);
        Map<String, Double> metricValues = metrics != null ? metrics.asMap() : Map.of();
        Map<String, Double> percentiles = percentileResolver.percentiles(metrics, results.list(distributionsTask));

        QualityScores quality5 = results.value(qualityTask);
        Integer piotroski = quality5 != null ? quality5.getPiotroskiScore() : null;
        Double altman = quality5 != null ? quality5.getAltmanZScore() : null;
        CompositeScore composite = results.value(compositeTask);
        Double financialHealth = composite != null ? composite.getFinancialHealthScore() : null;

        HealthScorer.HealthSignals signals = new HealthScorer.HealthSignals(
            piotroski, altman, financialHealth, percentiles.get("debt_to_equity"));
        InsightGenerator.Insights insights =
            insightGenerator.generate(metricValues, percentiles, stock.getSector(), piotroski, altman);

        log.info("Health summary for {}: {} of 5 sources, quality={}", ticker, sourcesAvailable, quality);
        return HealthSummaryReport.builder()
            .ticker(ticker)
            .health(healthScorer.assess(signals))
            .lifecycle(lifecycleInfo(results.value(lifecycleTask)))
            .strengths(insights.strengths())
            .concerns(insights.concerns())
            .redFlags(insights.redFlags())
            .dataQuality(quality)
            .sourcesAvailable(sourcesAvailable)
            .build();
    }

    // ── Metric history ────────────────────────────────────────────────────────

    public MetricHistoryReport metricHistory(String rawTicker, String rawMetric, String rawTimeframe, Integer rawLimit) {
        String ticker = normalise(rawTicker);
        String metric = rawMetric == null ? "" : rawMetric.trim().toLowerCase(Locale.ROOT);
        MetricCatalog.StatementField field = MetricCatalog.historyField(metric)
            .orElseThrow(() -> new UnknownMetricException(metric));

        InsightConfig.History cfg = config.history();
        String timeframeName = rawTimeframe == null || rawTimeframe.isBlank() ? cfg.getDefaultTimeframe() : rawTimeframe;
        Timeframe timeframe = Timeframe.parse(timeframeName)
            .orElseThrow(() -> new IllegalArgumentException("Timeframe must be 'quarterly' or 'annual'"));
        int limit = rawLimit != null && rawLimit > 0 && rawLimit <= cfg.getMaxLimit() ? rawLimit : cfg.getDefaultLimit();

        List<MetricDataPoint> series = repository.findMetricHistory(ticker, metric, timeframe, limit);
        if (series.isEmpty()) {
            throw new InsightUnavailableException(ticker, "No data found",
                String.format("No %s history available for %s", metric, ticker));
        }

        List<MetricDataPoint> points = trendAnalyzer.withYoyChanges(series, timeframe);
        return MetricHistoryReport.builder()
            .ticker(ticker)
            .metric(metric)
            .timeframe(timeframe)
            .unit(field.unit())
            .dataPoints(points)
            .trend(trendAnalyzer.analyse(points))
            .build();
    }

    // ── Peers ─────────────────────────────────────────────────────────────────

    /**
     * Similar-sized stocks from the same industry, widened to the whole sector
     * when the industry yields too few, compared on composite score and a few
     * headline metrics.
     */
    public PeersReport peers(String rawTicker, Integer rawLimit) {
        String ticker = normalise(rawTicker);
        InsightConfig.Peers cfg = config.peers();
        int limit = rawLimit != null && rawLimit > 0 && rawLimit <= cfg.getMaxLimit() ? rawLimit : cfg.getDefaultLimit();

        StockReference stock = repository.findStock(ticker)
            .orElseThrow(() -> new InsightUnavailableException(ticker, "Stock not found",
                String.format("No data available for %s", ticker)));
        Double marketCap = stock.getMarketCap();
        if (marketCap == null || marketCap == 0) {
            throw new InsightUnavailableException(ticker, "Market cap not available",
                String.format("Market cap data not available for %s, cannot determine peers", ticker));
        }

        FetchTask<PeerSelection> peersTask =
            FetchTask.optional("peers", () -> selectPeers(ticker, stock, marketCap, limit));
        FetchTask<CompositeScore> compositeTask =
            FetchTask.optional("composite score", () -> repository.findLatestCompositeScore(ticker).orElse(null));
        FetchTask<StockMetrics> metricsTask =
            FetchTask.optional("stock metrics", () -> repository.findMetrics(ticker).orElse(null));

        FetchResults results = coordinator.fetchAll(ticker, List.of(peersTask, compositeTask, metricsTask));
        FetchOutcome<PeerSelection> selection = results.outcome(peersTask);
        if (selection.failed()) {
            throw new UpstreamDataException("Failed to fetch peers for " + ticker, selection.error());
        }

        List<PeerData> peers = selection.value().candidates().stream()
            .map(FundamentalInsightService::peerData)
            .toList();
        CompositeScore composite = results.value(compositeTask);
        Double stockScore = composite != null ? composite.getOverallScore() : null;
        Double avgPeerScore = averageScore(peers);

        log.info("Peers for {}: {} from {}", ticker, peers.size(), selection.value().group().wireName());
        return PeersReport.builder()
            .ticker(ticker)
            .compositeScore(stockScore)
            .industry(stock.getIndustry())
            .peerSelection(selection.value().group())
            .peers(peers)
            .stockMetrics(stockMetrics(results.value(metricsTask), marketCap))
            .avgPeerScore(avgPeerScore)
            .vsPeersDelta(avgPeerScore != null && stockScore != null ? stockScore - avgPeerScore : null)
            .build();
    }

    private PeerSelection selectPeers(String ticker, StockReference stock, double marketCap, int limit) {
        List<PeerCandidate> peers = List.of();
        if (stock.getIndustry() != null && !stock.getIndustry().isBlank()) {
            try {
                peers = repository.findPeers(PeerGroup.INDUSTRY, stock.getIndustry(), marketCap, ticker, limit);
            } catch (UpstreamDataException e) {
                log.warn("Industry peers unavailable for {}, trying sector: {}", ticker, e.getMessage());
            }
        }
        if (peers.size() < config.peers().getMinIndustryPeers() && stock.hasSector()) {
            return new PeerSelection(PeerGroup.SECTOR,
                repository.findPeers(PeerGroup.SECTOR, stock.getSector(), marketCap, ticker, limit));
        }
        return new PeerSelection(PeerGroup.INDUSTRY, peers);
    }

    private record PeerSelection(PeerGroup group, List<PeerCandidate> candidates) {}

    private static PeerData peerData(PeerCandidate candidate) {
        PeerMetrics source = candidate.getMetrics() != null ? candidate.getMetrics() : new PeerMetrics();
        PeerMetrics metrics = PeerMetrics.builder()
            .peRatio(source.getPeRatio())
            .roe(source.getRoe())
            .revenueGrowthYoy(source.getRevenueGrowthYoy())
            .netMargin(source.getNetMargin())
            .debtToEquity(source.getDebtToEquity())
            .marketCap(candidate.getMarketCap())
            .build();
        return PeerData.builder()
            .ticker(candidate.getSymbol())
            .companyName(candidate.getName())
            .compositeScore(candidate.getCompositeScore())
            .industry(candidate.getIndustry())
            .metrics(metrics)
            .build();
    }

    private static PeerMetrics stockMetrics(StockMetrics metrics, double marketCap) {
        if (metrics == null) return null;
        return PeerMetrics.builder()
            .peRatio(metrics.value("pe_ratio"))
            .roe(metrics.value("roe"))
            .revenueGrowthYoy(metrics.value("revenue_growth_yoy"))
            .netMargin(metrics.value("net_margin"))
            .debtToEquity(metrics.value("debt_to_equity"))
            .marketCap(marketCap)
            .build();
    }

    /** Mean composite score over the peers that have one; null when none do. */
    static Double averageScore(List<PeerData> peers) {
        double total = 0;
        int count = 0;
        for (PeerData peer : peers) {
            if (peer.getCompositeScore() != null) {
                total += peer.getCompositeScore();
                count++;
            }
        }
        return count > 0 ? total / count : null;
    }

    // ── Helpers ────────────────────────────────────────────────────────────────

    private StockReference requireSector(String ticker) {
        StockReference stock = repository.findStock(ticker)
            .orElseThrow(() -> new InsightUnavailableException(ticker, "Stock not found",
                String.format("No data available for %s", ticker)));
        if (!stock.hasSector()) {
            throw new InsightUnavailableException(ticker, "Sector not available",
                String.format("No sector classification available for %s", ticker));
        }
        return stock;
    }

    private static LifecycleInfo lifecycleInfo(LifecycleClassification lc) {
        if (lc == null || lc.getLifecycleStage() == null) return null;
        return LifecycleInfo.builder()
            .stage(lc.getLifecycleStage())
            .description(LifecycleStage.describe(lc.getLifecycleStage()))
            .classifiedAt(lc.getClassifiedAt())
            .build();
    }

    private static String normalise(String ticker) {
        if (ticker == null || ticker.isBlank()) {
            throw new IllegalArgumentException("Ticker symbol is required");
        }
        return ticker.trim().toUpperCase(Locale.ROOT);
    }
}
