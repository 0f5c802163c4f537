package com.jay.insight.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Trailing-twelve-month ratios from the fundamentals vendor. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RatiosTtm {
    private String ticker;
    private Double grahamNumberTtm;
    private Double peRatioTtm;
    private Double priceToBookTtm;
}
