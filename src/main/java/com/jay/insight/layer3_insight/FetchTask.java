package com.jay.insight.layer3_insight;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * One independent upstream fetch. A supplier returning null means the
 * source had no data; throwing means the source failed.
 *
 * The task carries its own result slot, filled exactly once by the fetch
 * it takes part in, so a task belongs to a single fetch.
 */
public record FetchTask<T>(String source, boolean required, Supplier<T> supplier,
                           CompletableFuture<FetchOutcome<T>> slot) {

    public static <T> FetchTask<T> optional(String source, Supplier<T> supplier) {
        return new FetchTask<>(source, false, supplier, new CompletableFuture<>());
    }

    public static <T> FetchTask<T> required(String source, Supplier<T> supplier) {
        return new FetchTask<>(source, true, supplier, new CompletableFuture<>());
    }

    /** Runs the supplier on the calling thread and fills the slot with whatever it produced. */
    void run() {
        try {
            slot.complete(new FetchOutcome<>(source, supplier.get(), null));
        } catch (Exception e) {
            slot.complete(new FetchOutcome<>(source, null, e));
        }
    }

    /** Fills the slot with a failure unless the fetch already finished. */
    void fail(Throwable error) {
        slot.complete(new FetchOutcome<>(source, null, error));
    }
}
