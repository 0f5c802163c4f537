package com.jay.insight.layer3_insight;

import com.jay.insight.config.InsightConfig;
import com.jay.insight.layer1_data.UpstreamDataException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Layer 3 — Parallel Fetch Coordinator.
 * Starts every upstream fetch of a request at once and waits for all of them
 * behind a single barrier. Each task lands in its own result slot; one task
 * failing never cancels its siblings.
 *
 * The pool keeps {@code fetch.pool_size} threads warm and grows on demand,
 * so a task never waits in a queue behind another request's stuck fetch.
 * Fetches still running at the deadline are interrupted and recorded as timed out.
 *
 * After the barrier a failed or empty required task aborts the request.
 * Optional tasks only reduce what the report can show.
 */
@Slf4j
@Component
public class ParallelFetchCoordinator {

    private static final long IDLE_THREAD_KEEP_ALIVE_SECONDS = 60;

    private final ExecutorService executor;
    private final long timeoutSeconds;

    public ParallelFetchCoordinator(InsightConfig config) {
        InsightConfig.Fetch cfg = config.fetch();
        this.executor = new ThreadPoolExecutor(Math.max(1, cfg.getPoolSize()), Integer.MAX_VALUE,
            IDLE_THREAD_KEEP_ALIVE_SECONDS, TimeUnit.SECONDS, new SynchronousQueue<>(), fetchThreads());
        this.timeoutSeconds = cfg.getTimeoutSeconds();
    }

    public FetchResults fetchAll(String ticker, List<FetchTask<?>> tasks) {
        List<Future<?>> workers = new ArrayList<>(tasks.size());
        CompletableFuture<?>[] slots = new CompletableFuture<?>[tasks.size()];
        for (int i = 0; i < tasks.size(); i++) {
            FetchTask<?> task = tasks.get(i);
            slots[i] = task.slot();
            workers.add(executor.submit(task::run));
        }

        try {
            CompletableFuture.allOf(slots).get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Upstream fetch for {} exceeded {}s — continuing with completed sources", ticker, timeoutSeconds);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Upstream fetch for {} interrupted — continuing with completed sources", ticker);
        } catch (ExecutionException e) {
            // Slots are only ever completed normally, so the barrier itself cannot fail
            log.error("Unexpected fan-out failure for {}: {}", ticker, e.getMessage());
        }

        for (int i = 0; i < tasks.size(); i++) {
            FetchTask<?> task = tasks.get(i);
            if (!task.slot().isDone()) {
                // Record the timeout before interrupting so the worker cannot fill the slot first
                task.fail(new TimeoutException(task.source() + " timed out"));
                workers.get(i).cancel(true);
            }
            FetchOutcome<?> outcome = task.slot().join();
            if (outcome.failed()) {
                log.warn("{} unavailable for {}: {}", task.source(), ticker, outcome.error().getMessage());
            }
        }

        FetchResults results = new FetchResults(tasks);
        checkRequired(ticker, tasks, results);
        log.debug("Fetched {} of {} sources for {}", results.availableCount(), tasks.size(), ticker);
        return results;
    }

    private static void checkRequired(String ticker, List<FetchTask<?>> tasks, FetchResults results) {
        for (FetchTask<?> task : tasks) {
            if (!task.required()) continue;
            FetchOutcome<?> outcome = results.outcome(task);
            if (outcome.failed()) {
                throw new UpstreamDataException(
                    "Required source " + task.source() + " failed for " + ticker, outcome.error());
            }
            if (!outcome.isAvailable()) {
                throw new InsightUnavailableException(ticker, "No " + task.source(),
                    String.format("No %s available for %s", task.source(), ticker));
            }
        }
    }

    private static ThreadFactory fetchThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "insight-fetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
