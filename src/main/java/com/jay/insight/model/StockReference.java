package com.jay.insight.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockReference {
    private String symbol;
    private String name;
    private String sector;     // required for any sector-relative comparison
    private String industry;
    private Double marketCap;

    public boolean hasSector() {
        return sector != null && !sector.isBlank();
    }
}
