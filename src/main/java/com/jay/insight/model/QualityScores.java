package com.jay.insight.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityScores {
    private String ticker;
    private Integer piotroskiScore;   // 0-9
    private Double altmanZScore;      // continuous solvency score
}
