package com.jay.insight.model;

import com.jay.insight.model.enums.DataQuality;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class HealthSummaryReport {
    private String ticker;
    private HealthBadge health;
    private LifecycleInfo lifecycle;
    private List<StrengthConcern> strengths;
    private List<StrengthConcern> concerns;
    private List<RedFlag> redFlags;

    // ── Source coverage ───────────────────────────────────────────────────────
    private DataQuality dataQuality;
    private int sourcesAvailable;
}
