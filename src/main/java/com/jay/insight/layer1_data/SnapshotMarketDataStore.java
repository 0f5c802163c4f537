package com.jay.insight.layer1_data;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jay.insight.config.InsightConfig;
import com.jay.insight.model.CompositeScore;
import com.jay.insight.model.FairValueInputs;
import com.jay.insight.model.LifecycleClassification;
import com.jay.insight.model.MetricDataPoint;
import com.jay.insight.model.MetricDistribution;
import com.jay.insight.model.PeerCandidate;
import com.jay.insight.model.PriceTargetConsensus;
import com.jay.insight.model.QualityScores;
import com.jay.insight.model.RatiosTtm;
import com.jay.insight.model.StockMetrics;
import com.jay.insight.model.StockReference;
import com.jay.insight.model.enums.PeerGroup;
import com.jay.insight.model.enums.Timeframe;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Layer 1 — Snapshot Market Data Store.
 * Serves both upstream ports from JSON documents exported by the nightly
 * fundamentals jobs:
 *
 *   {location}/{TICKER}.json          — reference data, metrics, scores, history
 *   {location}/sectors/{sector}.json  — array of sector distributions
 *   {location}/universe.json          — array of peer candidates with scores and metrics
 *
 * Sector file names are the sector lower-cased with every run of
 * non-alphanumerics replaced by '_' ("Consumer Cyclical" → consumer_cyclical.json).
 * A missing document means "no data"; an unreadable one is an upstream failure.
 */
@Slf4j
@Component
public class SnapshotMarketDataStore implements FundamentalsRepository, ScoreProvider {

    private static final TypeReference<List<MetricDistribution>> DISTRIBUTION_LIST = new TypeReference<>() {};
    private static final TypeReference<List<PeerCandidate>> CANDIDATE_LIST = new TypeReference<>() {};

    // Market-cap band around the subject stock
    static final double PEER_CAP_FLOOR = 0.25;
    static final double PEER_CAP_CEILING = 4.0;

    private final ResourceLoader resourceLoader;
    private final String location;
    private final ObjectMapper mapper;

    public SnapshotMarketDataStore(ResourceLoader resourceLoader, InsightConfig config) {
        this.resourceLoader = resourceLoader;
        String loc = config.snapshot().getLocation();
        this.location = loc.endsWith("/") ? loc : loc + "/";
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    // ── FundamentalsRepository ────────────────────────────────────────────────

    @Override
    public Optional<StockReference> findStock(String ticker) {
        return section(ticker, TickerSnapshot::getStock);
    }

    @Override
    public List<MetricDistribution> findSectorDistributions(String sector) {
        Resource resource = resourceLoader.getResource(location + "sectors/" + sectorFileName(sector));
        if (!resource.exists()) {
            log.debug("No sector distribution document for '{}'", sector);
            return List.of();
        }
        try (InputStream is = resource.getInputStream()) {
            List<MetricDistribution> distributions = mapper.readValue(is, DISTRIBUTION_LIST);
            distributions.forEach(d -> { if (d.getSector() == null) d.setSector(sector); });
            return distributions;
        } catch (IOException e) {
            throw new UpstreamDataException("Unreadable sector document for " + sector, e);
        }
    }

    @Override
    public Optional<StockMetrics> findMetrics(String ticker) {
        return section(ticker, s -> s.getMetrics() == null ? null
            : StockMetrics.builder().ticker(ticker).values(new HashMap<>(s.getMetrics())).build());
    }

    @Override
    public Optional<CompositeScore> findLatestCompositeScore(String ticker) {
        return section(ticker, TickerSnapshot::getCompositeScore);
    }

    @Override
    public Optional<LifecycleClassification> findLifecycle(String ticker) {
        return section(ticker, TickerSnapshot::getLifecycle);
    }

    @Override
    public Optional<FairValueInputs> findFairValueInputs(String ticker) {
        return section(ticker, TickerSnapshot::getFairValue);
    }

    @Override
    public List<MetricDataPoint> findMetricHistory(String ticker, String metric, Timeframe timeframe, int limit) {
        return section(ticker, TickerSnapshot::getHistory)
            .map(h -> h.get(metric))
            .map(byTimeframe -> byTimeframe.get(timeframe.wireName()))
            .map(points -> points.stream()
                .sorted(Comparator.comparing(MetricDataPoint::getPeriodEnd,
                    Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(limit)
                .toList())
            .orElse(List.of());
    }

    @Override
    public List<PeerCandidate> findPeers(PeerGroup group, String groupName, double marketCap,
                                         String excludeTicker, int limit) {
        if (groupName == null || groupName.isBlank()) return List.of();
        double floor = marketCap * PEER_CAP_FLOOR;
        double ceiling = marketCap * PEER_CAP_CEILING;

        return loadUniverse().stream()
            .filter(c -> groupName.equals(group == PeerGroup.INDUSTRY ? c.getIndustry() : c.getSector()))
            .filter(c -> c.getSymbol() != null && !c.getSymbol().equalsIgnoreCase(excludeTicker))
            .filter(c -> c.getMarketCap() != null && c.getMarketCap() >= floor && c.getMarketCap() <= ceiling)
            .sorted(Comparator.comparingDouble(c -> Math.abs(c.getMarketCap() - marketCap)))
            .limit(Math.max(0, limit))
            .toList();
    }

    // ── ScoreProvider ─────────────────────────────────────────────────────────

    @Override
    public Optional<QualityScores> fetchQualityScores(String ticker) {
        return section(ticker, TickerSnapshot::getQualityScores);
    }

    @Override
    public Optional<RatiosTtm> fetchRatiosTtm(String ticker) {
        return section(ticker, TickerSnapshot::getRatiosTtm);
    }

    @Override
    public Optional<PriceTargetConsensus> fetchPriceTargetConsensus(String ticker) {
        return section(ticker, TickerSnapshot::getPriceTarget);
    }

    // ── Document access ───────────────────────────────────────────────────────

    private <T> Optional<T> section(String ticker, Function<TickerSnapshot, T> extractor) {
        return loadTicker(ticker).map(extractor);
    }

    private Optional<TickerSnapshot> loadTicker(String ticker) {
        String symbol = ticker.toUpperCase(Locale.ROOT).trim();
        Resource resource = resourceLoader.getResource(location + symbol + ".json");
        if (!resource.exists()) {
            return Optional.empty();
        }
        try (InputStream is = resource.getInputStream()) {
            return Optional.of(mapper.readValue(is, TickerSnapshot.class));
        } catch (IOException e) {
            throw new UpstreamDataException("Unreadable snapshot for " + symbol, e);
        }
    }

    private List<PeerCandidate> loadUniverse() {
        Resource resource = resourceLoader.getResource(location + "universe.json");
        if (!resource.exists()) {
            log.debug("No peer universe document under {}", location);
            return List.of();
        }
        try (InputStream is = resource.getInputStream()) {
            return mapper.readValue(is, CANDIDATE_LIST);
        } catch (IOException e) {
            throw new UpstreamDataException("Unreadable peer universe", e);
        }
    }

    static String sectorFileName(String sector) {
        String slug = sector.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        return slug + ".json";
    }

    /** On-disk layout of one ticker document. Every section is optional. */
    @Data
    static class TickerSnapshot {
        private StockReference stock;
        private Map<String, Double> metrics;
        private CompositeScore compositeScore;
        private LifecycleClassification lifecycle;
        private FairValueInputs fairValue;
        private QualityScores qualityScores;
        private RatiosTtm ratiosTtm;
        private PriceTargetConsensus priceTarget;
        // metric → timeframe ("quarterly" / "annual") → points
        private Map<String, Map<String, List<MetricDataPoint>>> history;
    }
}
