package com.jay.insight.layer3_insight;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Outcomes of one fan-out, one slot per task, readable only after the join.
 */
public final class FetchResults {

    private final Set<FetchTask<?>> tasks = Collections.newSetFromMap(new IdentityHashMap<>());

    FetchResults(List<FetchTask<?>> tasks) {
        this.tasks.addAll(tasks);
    }

    public <T> FetchOutcome<T> outcome(FetchTask<T> task) {
        if (!tasks.contains(task) || !task.slot().isDone()) {
            throw new IllegalArgumentException("Task '" + task.source() + "' was not part of this fetch");
        }
        return task.slot().join();
    }

    /** The task's value, or null when it had no data or failed. */
    public <T> T value(FetchTask<T> task) {
        FetchOutcome<T> outcome = outcome(task);
        return outcome.failed() ? null : outcome.value();
    }

    public <T> List<T> list(FetchTask<List<T>> task) {
        List<T> value = value(task);
        return value == null ? List.of() : value;
    }

    /** Number of tasks that produced usable data. */
    public int availableCount() {
        int count = 0;
        for (FetchTask<?> task : tasks) {
            if (outcome(task).isAvailable()) count++;
        }
        return count;
    }

    public int failedCount() {
        int count = 0;
        for (FetchTask<?> task : tasks) {
            if (outcome(task).failed()) count++;
        }
        return count;
    }
}
