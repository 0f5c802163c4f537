package com.jay.insight.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Stored valuation-model outputs for a stock; every field is optional. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FairValueInputs {
    private String ticker;
    private Double dcfFairValue;
    private Double epvFairValue;
    private Double grahamNumber;
    private Double wacc;
    private Double stockPrice;
}
