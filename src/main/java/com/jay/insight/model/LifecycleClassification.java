package com.jay.insight.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LifecycleClassification {
    private String ticker;
    private String lifecycleStage;   // hypergrowth / growth / mature / value / turnaround
    private LocalDate classifiedAt;
}
