package com.jay.insight.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Latest metric snapshot for one stock. A metric mapped to null is known
 * but missing; it is excluded from every computation that needs it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockMetrics {
    private String ticker;
    @Builder.Default
    private Map<String, Double> values = new HashMap<>();

    public Double value(String metric) {
        return values == null ? null : values.get(metric);
    }

    public Map<String, Double> asMap() {
        return values == null ? Map.of() : Collections.unmodifiableMap(values);
    }
}
