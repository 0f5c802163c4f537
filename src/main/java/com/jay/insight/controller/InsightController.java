package com.jay.insight.controller;

import com.jay.insight.layer1_data.UpstreamDataException;
import com.jay.insight.layer3_insight.FundamentalInsightService;
import com.jay.insight.layer3_insight.InsightUnavailableException;
import com.jay.insight.layer3_insight.UnknownMetricException;
import com.jay.insight.model.FairValueReport;
import com.jay.insight.model.HealthSummaryReport;
import com.jay.insight.model.MetricHistoryReport;
import com.jay.insight.model.PeersReport;
import com.jay.insight.model.SectorPercentilesReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * REST API — Stock Insights.
 * Thin adapter over {@link FundamentalInsightService}; every response is
 * wrapped as {@code {data, meta}}.
 *
 * Endpoints:
 *   GET /api/stocks/{ticker}/sector-percentiles        — Percentiles within the sector
 *   GET /api/stocks/{ticker}/fair-value                — Fair-value models and margin of safety
 *   GET /api/stocks/{ticker}/health-summary            — Badge, lifecycle, strengths, concerns, red flags
 *   GET /api/stocks/{ticker}/metric-history/{metric}   — Metric series with YoY changes and trend
 *   GET /api/stocks/{ticker}/peers                     — Similar-sized industry or sector peers
 */
@Slf4j
@RestController
@RequestMapping("/api/stocks")
@RequiredArgsConstructor
public class InsightController {

    private final FundamentalInsightService insightService;

    // ── GET /api/stocks/{ticker}/sector-percentiles ────────────────────────────

    @GetMapping("/{ticker}/sector-percentiles")
    public ResponseEntity<Map<String, Object>> sectorPercentiles(
            @PathVariable String ticker,
            @RequestParam(name = "metrics", required = false) String metrics) {
        SectorPercentilesReport report = insightService.sectorPercentiles(ticker, parseMetricFilter(metrics));
        return ResponseEntity.ok(envelope(report, Map.of("metric_count", report.getMetrics().size())));
    }

    // ── GET /api/stocks/{ticker}/fair-value ────────────────────────────────────

    @GetMapping("/{ticker}/fair-value")
    public ResponseEntity<Map<String, Object>> fairValue(@PathVariable String ticker) {
        FairValueReport report = insightService.fairValue(ticker);
        return ResponseEntity.ok(envelope(report, Map.of("model_count", report.getModels().size())));
    }

    // ── GET /api/stocks/{ticker}/health-summary ────────────────────────────────

    @GetMapping("/{ticker}/health-summary")
    public ResponseEntity<Map<String, Object>> healthSummary(@PathVariable String ticker) {
        HealthSummaryReport report = insightService.healthSummary(ticker);
        return ResponseEntity.ok(envelope(report, Map.of(
            "data_quality", report.getDataQuality(),
            "sources_available", report.getSourcesAvailable())));
    }

    // ── GET /api/stocks/{ticker}/metric-history/{metric} ───────────────────────

    @GetMapping("/{ticker}/metric-history/{metric}")
    public ResponseEntity<Map<String, Object>> metricHistory(
            @PathVariable String ticker,
            @PathVariable String metric,
            @RequestParam(required = false) String timeframe,
            @RequestParam(required = false) Integer limit) {
        MetricHistoryReport report = insightService.metricHistory(ticker, metric, timeframe, limit);
        return ResponseEntity.ok(envelope(report, Map.of("available_periods", report.getDataPoints().size())));
    }

    // ── GET /api/stocks/{ticker}/peers ─────────────────────────────────────────

    @GetMapping("/{ticker}/peers")
    public ResponseEntity<Map<String, Object>> peers(
            @PathVariable String ticker,
            @RequestParam(required = false) String limit) {
        PeersReport report = insightService.peers(ticker, parseLimit(limit));
        return ResponseEntity.ok(envelope(report, Map.of(
            "peer_selection", report.getPeerSelection().wireName() + " + market cap proximity",
            "peer_count", report.getPeers().size())));
    }

    // ── Error mapping ──────────────────────────────────────────────────────────

    @ExceptionHandler(InsightUnavailableException.class)
    public ResponseEntity<Map<String, Object>> unavailable(InsightUnavailableException e) {
        log.info("Insight unavailable for {}: {}", e.getTicker(), e.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getReason());
        body.put("message", e.getMessage());
        body.put("ticker", e.getTicker());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }

    @ExceptionHandler(UnknownMetricException.class)
    public ResponseEntity<Map<String, Object>> unknownMetric(UnknownMetricException e) {
        return ResponseEntity.badRequest().body(Map.of(
            "error", "Unknown metric",
            "message", e.getMessage(),
            "valid_metrics", e.getValidMetrics()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of(
            "error", "Invalid request",
            "message", e.getMessage()));
    }

    @ExceptionHandler(UpstreamDataException.class)
    public ResponseEntity<Map<String, Object>> upstreamFailure(UpstreamDataException e) {
        log.error("Upstream data failure: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
            "error", "Upstream data unavailable",
            "message", e.getMessage()));
    }

    // ── Helpers ────────────────────────────────────────────────────────────────

    private static Map<String, Object> envelope(Object data, Map<String, Object> meta) {
        Map<String, Object> fullMeta = new LinkedHashMap<>();
        fullMeta.put("timestamp", Instant.now().toString());
        fullMeta.putAll(meta);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("data", data);
        body.put("meta", fullMeta);
        return body;
    }

    /** Unparseable limits fall back to the configured default, like out-of-range ones. */
    static Integer parseLimit(String limit) {
        if (limit == null || limit.isBlank()) return null;
        try {
            return Integer.valueOf(limit.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric limit '{}'", limit);
            return null;
        }
    }

    static Set<String> parseMetricFilter(String metrics) {
        if (metrics == null || metrics.isBlank()) return Set.of();
        return Arrays.stream(metrics.split(","))
            .map(m -> m.trim().toLowerCase(Locale.ROOT))
            .filter(m -> !m.isEmpty())
            .collect(Collectors.toSet());
    }
}
