package com.jay.insight.layer3_insight;

import lombok.Getter;

/**
 * A required input (the stock itself, its sector, its sector distributions)
 * is missing, so the requested insight cannot be computed at all. This is
 * distinct from a report that merely has fewer signals available.
 */
@Getter
public class InsightUnavailableException extends RuntimeException {

    private final String ticker;
    private final String reason;

    public InsightUnavailableException(String ticker, String reason, String message) {
        super(message);
        this.ticker = ticker;
        this.reason = reason;
    }
}
