package com.jay.insight.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/** Latest in-house composite score and its financial-health factor (both 0-100). */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompositeScore {
    private String ticker;
    private Double overallScore;
    private Double financialHealthScore;
    private LocalDate calculatedAt;
}
