package com.jay.insight.layer3_insight;

import java.util.Collection;

/** What one fetch task produced: a value, nothing, or an error. */
public record FetchOutcome<T>(String source, T value, Throwable error) {

    /** A value is present; an empty collection counts as no data. */
    public boolean isAvailable() {
        if (error != null || value == null) return false;
        return !(value instanceof Collection<?> c) || !c.isEmpty();
    }

    public boolean failed() {
        return error != null;
    }
}
