package com.jay.insight.controller;

import com.jay.insight.layer1_data.UpstreamDataException;
import com.jay.insight.layer3_insight.FundamentalInsightService;
import com.jay.insight.layer3_insight.InsightUnavailableException;
import com.jay.insight.layer3_insight.UnknownMetricException;
import com.jay.insight.model.FairValueReport;
import com.jay.insight.model.HealthBadge;
import com.jay.insight.model.HealthSummaryReport;
import com.jay.insight.model.MetricDataPoint;
import com.jay.insight.model.MetricHistoryReport;
import com.jay.insight.model.MetricPercentile;
import com.jay.insight.model.PeerData;
import com.jay.insight.model.PeerMetrics;
import com.jay.insight.model.PeersReport;
import com.jay.insight.model.SectorPercentilesReport;
import com.jay.insight.model.enums.DataQuality;
import com.jay.insight.model.enums.HealthTier;
import com.jay.insight.model.enums.PeerGroup;
import com.jay.insight.model.enums.Timeframe;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(InsightController.class)
class InsightControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FundamentalInsightService insightService;

    @Test
    void sectorPercentilesWrapsReportWithMetricCount() throws Exception {
        SectorPercentilesReport report = SectorPercentilesReport.builder()
            .ticker("AAPL").sector("Technology").calculatedAt(LocalDate.of(2024, 11, 15)).sampleCount(612)
            .metrics(Map.of("roe", MetricPercentile.builder().value(147.3).percentile(99.3).build()))
            .build();
        when(insightService.sectorPercentiles(eq("aapl"), any())).thenReturn(report);

        mockMvc.perform(get("/api/stocks/aapl/sector-percentiles").param("metrics", "ROE, pe_ratio,"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.ticker").value("AAPL"))
            .andExpect(jsonPath("$.data.calculated_at").value("2024-11-15"))
            .andExpect(jsonPath("$.data.sample_count").value(612))
            .andExpect(jsonPath("$.data.metrics.roe.percentile").value(99.3))
            .andExpect(jsonPath("$.meta.metric_count").value(1))
            .andExpect(jsonPath("$.meta.timestamp").exists());

        verify(insightService).sectorPercentiles("aapl", Set.of("roe", "pe_ratio"));
    }

    @Test
    void fairValueReportsSuppression() throws Exception {
        when(insightService.fairValue("XYZ")).thenReturn(FairValueReport.builder()
            .ticker("XYZ").models(Map.of()).suppressed(true)
            .suppressionReason("Insufficient financial data to compute fair value estimates")
            .build());

        mockMvc.perform(get("/api/stocks/XYZ/fair-value"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.suppressed").value(true))
            .andExpect(jsonPath("$.data.suppression_reason")
                .value("Insufficient financial data to compute fair value estimates"))
            .andExpect(jsonPath("$.data.margin_of_safety").doesNotExist())
            .andExpect(jsonPath("$.meta.model_count").value(0));
    }

    @Test
    void healthSummaryExposesDataQualityInMeta() throws Exception {
        when(insightService.healthSummary("AAPL")).thenReturn(HealthSummaryReport.builder()
            .ticker("AAPL")
            .health(HealthBadge.builder().badge(HealthTier.STRONG).score(91.2).components(Map.of()).build())
            .strengths(List.of()).concerns(List.of()).redFlags(List.of())
            .dataQuality(DataQuality.PARTIAL).sourcesAvailable(2)
            .build());

        mockMvc.perform(get("/api/stocks/AAPL/health-summary"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.health.badge").value("Strong"))
            .andExpect(jsonPath("$.data.health.score").value(91.2))
            .andExpect(jsonPath("$.data.red_flags").isArray())
            .andExpect(jsonPath("$.meta.data_quality").value("partial"))
            .andExpect(jsonPath("$.meta.sources_available").value(2));
    }

    @Test
    void metricHistoryPassesQueryParameters() throws Exception {
        when(insightService.metricHistory("AAPL", "revenue", "annual", 5)).thenReturn(MetricHistoryReport.builder()
            .ticker("AAPL").metric("revenue").timeframe(Timeframe.ANNUAL).unit("USD")
            .dataPoints(List.of(
                MetricDataPoint.builder().fiscalYear(2024).value(391.0).yoyChange(0.02).build(),
                MetricDataPoint.builder().fiscalYear(2023).value(383.0).build()))
            .build());

        mockMvc.perform(get("/api/stocks/AAPL/metric-history/revenue")
                .param("timeframe", "annual").param("limit", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.timeframe").value("annual"))
            .andExpect(jsonPath("$.data.data_points[0].yoy_change").value(0.02))
            .andExpect(jsonPath("$.data.data_points[1].yoy_change").doesNotExist())
            .andExpect(jsonPath("$.meta.available_periods").value(2));
    }

    @Test
    void peersReportCarriesSelectionAndCountInMeta() throws Exception {
        PeersReport report = PeersReport.builder()
            .ticker("ACME")
            .compositeScore(72.0)
            .industry("Specialty Retail")
            .peerSelection(PeerGroup.SECTOR)
            .peers(List.of(PeerData.builder()
                .ticker("AUTO").companyName("Auto Parts Co").compositeScore(50.0).industry("Auto Parts")
                .metrics(PeerMetrics.builder().marketCap(2.1e9).build())
                .build()))
            .avgPeerScore(50.0)
            .vsPeersDelta(22.0)
            .build();
        when(insightService.peers("ACME", 3)).thenReturn(report);

        mockMvc.perform(get("/api/stocks/ACME/peers").param("limit", "3"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.peer_selection").value("sector"))
            .andExpect(jsonPath("$.data.peers[0].company_name").value("Auto Parts Co"))
            .andExpect(jsonPath("$.data.peers[0].metrics.market_cap").value(2.1e9))
            .andExpect(jsonPath("$.data.peers[0].metrics.roe").doesNotExist())
            .andExpect(jsonPath("$.data.vs_peers_delta").value(22.0))
            .andExpect(jsonPath("$.data.stock_metrics").doesNotExist())
            .andExpect(jsonPath("$.meta.peer_selection").value("sector + market cap proximity"))
            .andExpect(jsonPath("$.meta.peer_count").value(1));
    }

    @Test
    void nonNumericPeerLimitUsesTheDefault() throws Exception {
        when(insightService.peers("ACME", null)).thenReturn(PeersReport.builder()
            .ticker("ACME").peerSelection(PeerGroup.INDUSTRY).peers(List.of()).build());

        mockMvc.perform(get("/api/stocks/ACME/peers").param("limit", "lots"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.meta.peer_count").value(0));
        verify(insightService).peers("ACME", null);
    }

    @Test
    void missingMarketCapMapsToNotFound() throws Exception {
        when(insightService.peers("ACME", null)).thenThrow(new InsightUnavailableException("ACME",
            "Market cap not available", "Market cap data not available for ACME, cannot determine peers"));

        mockMvc.perform(get("/api/stocks/ACME/peers"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Market cap not available"));
    }

    @Test
    void unavailableInsightMapsToNotFound() throws Exception {
        when(insightService.healthSummary("NOPE"))
            .thenThrow(new InsightUnavailableException("NOPE", "Stock not found", "No data available for NOPE"));

        mockMvc.perform(get("/api/stocks/NOPE/health-summary"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Stock not found"))
            .andExpect(jsonPath("$.message").value("No data available for NOPE"))
            .andExpect(jsonPath("$.ticker").value("NOPE"));
    }

    @Test
    void unknownMetricListsValidMetrics() throws Exception {
        when(insightService.metricHistory("AAPL", "market_cap", null, null))
            .thenThrow(new UnknownMetricException("market_cap"));

        mockMvc.perform(get("/api/stocks/AAPL/metric-history/market_cap"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Unknown metric"))
            .andExpect(jsonPath("$.message").value("Metric 'market_cap' is not supported"))
            .andExpect(jsonPath("$.valid_metrics", hasItem("revenue")));
    }

    @Test
    void invalidTimeframeIsBadRequest() throws Exception {
        when(insightService.metricHistory("AAPL", "revenue", "monthly", null))
            .thenThrow(new IllegalArgumentException("Timeframe must be 'quarterly' or 'annual'"));

        mockMvc.perform(get("/api/stocks/AAPL/metric-history/revenue").param("timeframe", "monthly"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Timeframe must be 'quarterly' or 'annual'"));
    }

    @Test
    void upstreamFailureIsServiceUnavailable() throws Exception {
        when(insightService.fairValue("AAPL")).thenThrow(new UpstreamDataException("store offline"));

        mockMvc.perform(get("/api/stocks/AAPL/fair-value"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("Upstream data unavailable"));
    }

    @Test
    void metricFilterParsingIgnoresBlanks() {
        assertThat(InsightController.parseMetricFilter(null)).isEmpty();
        assertThat(InsightController.parseMetricFilter(" , ")).isEmpty();
        assertThat(InsightController.parseMetricFilter("ROE,net_margin")).containsExactlyInAnyOrder("roe", "net_margin");
    }
}
