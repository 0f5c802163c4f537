package com.jay.insight.layer3_insight;

import com.jay.insight.model.MetricCatalog;
import lombok.Getter;

import java.util.Set;

@Getter
public class UnknownMetricException extends RuntimeException {

    private final String metric;

    public UnknownMetricException(String metric) {
        super(String.format("Metric '%s' is not supported", metric));
        this.metric = metric;
    }

    public Set<String> getValidMetrics() {
        return MetricCatalog.historyMetrics();
    }
}
