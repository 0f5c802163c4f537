package com.jay.insight.model.enums;

public enum LifecycleStage {
    HYPERGROWTH("Hypergrowth company with >50% revenue growth. Focus on growth trajectory over current profitability."),
    GROWTH("Growth company with 20-50% revenue growth. Balancing expansion with emerging profitability."),
    MATURE("Mature company with stable operations. Focus on profitability, cash flow, and capital efficiency."),
    VALUE("Value opportunity with low valuation and solid margins. Focus on intrinsic value and dividend potential."),
    TURNAROUND("Turnaround situation with declining revenue. Focus on financial health and recovery signals.");

    private final String description;

    LifecycleStage(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /** Description for a stage name as stored upstream; unknown names are not an error. */
    public static String describe(String stage) {
        if (stage == null) return "Unknown lifecycle stage";
        for (LifecycleStage s : values()) {
            if (s.name().equalsIgnoreCase(stage.trim())) return s.description;
        }
        return "Unknown lifecycle stage";
    }
}
