package com.jay.insight.model;

import lombok.Builder;
import lombok.Data;

/** A strength or concern derived from a sector percentile ranking. */
@Data
@Builder
public class StrengthConcern {
    private String metric;
    private Double value;
    private Double percentile;
    private String message;
}
