package com.jay.insight.model;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Static per-metric tables: direction, display names and the financial
 * statement each historical metric is read from.
 */
public final class MetricCatalog {

    private MetricCatalog() {}

    private static final Set<String> LOWER_IS_BETTER = Set.of(
        "pe_ratio", "ps_ratio", "pb_ratio", "ev_ebitda", "peg_ratio",
        "debt_to_equity", "net_debt_to_ebitda"
    );

    private static final Map<String, String> DISPLAY_NAMES = Map.ofEntries(
        Map.entry("gross_margin",       "Gross margin"),
        Map.entry("operating_margin",   "Operating margin"),
        Map.entry("net_margin",         "Net margin"),
        Map.entry("ebitda_margin",      "EBITDA margin"),
        Map.entry("roe",                "Return on equity"),
        Map.entry("roa",                "Return on assets"),
        Map.entry("roic",               "Return on invested capital"),
        Map.entry("revenue_growth_yoy", "Revenue growth (YoY)"),
        Map.entry("eps_growth_yoy",     "EPS growth (YoY)"),
        Map.entry("current_ratio",      "Current ratio"),
        Map.entry("quick_ratio",        "Quick ratio"),
        Map.entry("debt_to_equity",     "Debt/Equity"),
        Map.entry("interest_coverage",  "Interest coverage"),
        Map.entry("dividend_yield",     "Dividend yield"),
        Map.entry("pe_ratio",           "P/E ratio"),
        Map.entry("pb_ratio",           "P/B ratio"),
        Map.entry("ps_ratio",           "P/S ratio"),
        Map.entry("ev_ebitda",          "EV/EBITDA"),
        Map.entry("ev_to_ebitda",       "EV/EBITDA")
    );

    public record StatementField(String statementType, String fieldName, String unit) {}

    private static final Map<String, StatementField> HISTORY_FIELDS = Map.ofEntries(
        Map.entry("revenue",          new StatementField("income", "revenues", "USD")),
        Map.entry("net_income",       new StatementField("income", "net_income_loss", "USD")),
        Map.entry("gross_profit",     new StatementField("income", "gross_profit", "USD")),
        Map.entry("operating_income", new StatementField("income", "operating_income_loss", "USD")),
        Map.entry("eps",              new StatementField("income", "diluted_earnings_per_share", "USD")),
        Map.entry("gross_margin",     new StatementField("ratios", "gross_margin", "percent")),
        Map.entry("operating_margin", new StatementField("ratios", "operating_margin", "percent")),
        Map.entry("net_margin",       new StatementField("ratios", "net_profit_margin", "percent")),
        Map.entry("roe",              new StatementField("ratios", "return_on_equity", "percent")),
        Map.entry("roa",              new StatementField("ratios", "return_on_assets", "percent")),
        Map.entry("debt_to_equity",   new StatementField("ratios", "debt_to_equity", "ratio")),
        Map.entry("current_ratio",    new StatementField("ratios", "current_ratio", "ratio"))
    );

    public static boolean isLowerBetter(String metric) {
        return metric != null && LOWER_IS_BETTER.contains(metric);
    }

    /** Human-readable name, or the raw key when the metric has no entry. */
    public static String displayName(String metric) {
        return DISPLAY_NAMES.getOrDefault(metric, metric);
    }

    public static Optional<StatementField> historyField(String metric) {
        return Optional.ofNullable(metric).map(HISTORY_FIELDS::get);
    }

    public static Set<String> historyMetrics() {
        return new TreeSet<>(HISTORY_FIELDS.keySet());
    }
}
