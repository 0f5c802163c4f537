package com.jay.insight.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.PropertyPlaceholderHelper;

import java.io.InputStream;

/**
 * Loads and exposes the insight engine configuration from insight.yaml.
 * Values are read once at startup. Algorithm thresholds that define the
 * scoring model itself are code constants and do not live here.
 */
@Slf4j
@Component
public class InsightConfig {

    private static final PropertyPlaceholderHelper PLACEHOLDER_HELPER =
        new PropertyPlaceholderHelper("${", "}", ":", true);

    private final String configFile;
    private final Environment env;

    // ── Sections ──────────────────────────────────────────────────────────────
    private Insights insights = new Insights();
    private Fetch fetch = new Fetch();
    private History history = new History();
    private Peers peers = new Peers();
    private Snapshot snapshot = new Snapshot();

    public InsightConfig(@Value("${insight.config-file:insight.yaml}") String configFile,
                         Environment env) {
        this.configFile = configFile;
        this.env = env;
    }

    /** Resolves ${VAR:default} placeholders using Spring Environment (env vars / system props). */
    private String resolve(String value) {
        if (value == null) return null;
        return PLACEHOLDER_HELPER.replacePlaceholders(value, env::getProperty);
    }

    @PostConstruct
    public void load() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(configFile)) {
            if (is == null) {
                log.warn("Config file '{}' not found on classpath — using defaults", configFile);
                return;
            }
            ConfigRoot root = mapper.readValue(is, ConfigRoot.class);
            if (root.getInsights() != null) this.insights = root.getInsights();
            if (root.getFetch() != null)    this.fetch    = root.getFetch();
            if (root.getHistory() != null)  this.history  = root.getHistory();
            if (root.getPeers() != null)    this.peers    = root.getPeers();
            if (root.getSnapshot() != null) this.snapshot = root.getSnapshot();

            this.snapshot.setLocation(resolve(this.snapshot.getLocation()));
            log.info("InsightConfig loaded from '{}'. Fetch pool={} timeout={}s snapshots={}",
                configFile, fetch.getPoolSize(), fetch.getTimeoutSeconds(), snapshot.getLocation());
        } catch (Exception e) {
            log.error("Failed to load {} — engine will use defaults: {}", configFile, e.getMessage());
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Insights insights() { return insights; }
    public Fetch fetch()       { return fetch; }
    public History history()   { return history; }
    public Peers peers()       { return peers; }
    public Snapshot snapshot() { return snapshot; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Insights insights = new Insights();
        private Fetch fetch = new Fetch();
        private History history = new History();
        private Peers peers = new Peers();
        private Snapshot snapshot = new Snapshot();
    }

    @Data public static class Insights {
        private int maxStrengths = 3;
        private int maxConcerns = 3;
    }

    @Data public static class Fetch {
        private int poolSize = 8;
        private long timeoutSeconds = 10;
    }

    @Data public static class History {
        private int defaultLimit = 20;
        private int maxLimit = 40;
        private String defaultTimeframe = "quarterly";
    }

    @Data public static class Peers {
        private int defaultLimit = 5;
        private int maxLimit = 10;
        // Fewer industry peers than this widens the search to the sector
        private int minIndustryPeers = 3;
    }

    @Data public static class Snapshot {
        private String location = "classpath:snapshots/";
    }
}
