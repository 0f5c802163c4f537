package com.jay.insight.layer3_insight;

import com.jay.insight.config.InsightConfig;
import com.jay.insight.layer1_data.UpstreamDataException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParallelFetchCoordinatorTest {

    private ParallelFetchCoordinator coordinator;

    @BeforeEach
    void setUp() {
        InsightConfig config = new InsightConfig("insight.yaml", new MockEnvironment());
        config.fetch().setPoolSize(4);
        config.fetch().setTimeoutSeconds(1);
        coordinator = new ParallelFetchCoordinator(config);
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
    }

    @Test
    void everyTaskLandsInItsOwnSlot() {
        FetchTask<String> name = FetchTask.optional("name", () -> "Acme");
        FetchTask<Integer> score = FetchTask.optional("score", () -> 7);
        FetchTask<List<String>> peers = FetchTask.optional("peers", () -> List.of("X", "Y"));

        FetchResults results = coordinator.fetchAll("ACME", List.of(name, score, peers));

        assertThat(results.value(name)).isEqualTo("Acme");
        assertThat(results.value(score)).isEqualTo(7);
        assertThat(results.list(peers)).containsExactly("X", "Y");
        assertThat(results.availableCount()).isEqualTo(3);
        assertThat(results.failedCount()).isZero();
    }

    @Test
    void tasksRunConcurrently() {
        // Each task waits for the other; a sequential run would never release them
        CountDownLatch bothStarted = new CountDownLatch(2);
        FetchTask<Boolean> a = FetchTask.optional("a", () -> awaitLatch(bothStarted));
        FetchTask<Boolean> b = FetchTask.optional("b", () -> awaitLatch(bothStarted));

        FetchResults results = coordinator.fetchAll("ACME", List.of(a, b));

        assertThat(results.value(a)).isTrue();
        assertThat(results.value(b)).isTrue();
    }

    @Test
    void failingTaskDoesNotCancelSiblings() {
        CountDownLatch slowDone = new CountDownLatch(1);
        FetchTask<String> failing = FetchTask.optional("vendor", () -> {
            throw new UpstreamDataException("vendor down");
        });
        FetchTask<String> slow = FetchTask.optional("store", () -> {
            sleep(150);
            slowDone.countDown();
            return "stored";
        });

        FetchResults results = coordinator.fetchAll("ACME", List.of(failing, slow));

        assertThat(slowDone.getCount()).isZero();
        assertThat(results.value(slow)).isEqualTo("stored");
        assertThat(results.value(failing)).isNull();
        assertThat(results.outcome(failing).error())
            .isInstanceOf(UpstreamDataException.class)
            .hasMessage("vendor down");
        assertThat(results.availableCount()).isEqualTo(1);
        assertThat(results.failedCount()).isEqualTo(1);
    }

    @Test
    void nullAndEmptyResultsAreNotAvailable() {
        FetchTask<String> none = FetchTask.optional("none", () -> null);
        FetchTask<List<String>> empty = FetchTask.optional("empty", List::of);

        FetchResults results = coordinator.fetchAll("ACME", List.of(none, empty));

        assertThat(results.availableCount()).isZero();
        assertThat(results.failedCount()).isZero();
        assertThat(results.list(empty)).isEmpty();
    }

    @Test
    void failedRequiredTaskRaisesUpstreamError() {
        FetchTask<List<String>> required = FetchTask.required("sector distributions", () -> {
            throw new IllegalStateException("connection reset");
        });
        FetchTask<String> optional = FetchTask.optional("metrics", () -> "m");

        assertThatThrownBy(() -> coordinator.fetchAll("ACME", List.of(required, optional)))
            .isInstanceOf(UpstreamDataException.class)
            .hasMessageContaining("sector distributions")
            .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void emptyRequiredTaskMakesInsightUnavailable() {
        FetchTask<List<String>> required = FetchTask.required("sector distributions", List::of);

        assertThatThrownBy(() -> coordinator.fetchAll("ACME", List.of(required)))
            .isInstanceOf(InsightUnavailableException.class)
            .hasMessageContaining("ACME");
    }

    @Test
    void taskPastTheDeadlineIsRecordedAsTimedOut() {
        FetchTask<String> hung = FetchTask.optional("hung", () -> {
            sleep(10_000);
            return "late";
        });
        FetchTask<String> quick = FetchTask.optional("quick", () -> "ok");

        long start = System.nanoTime();
        FetchResults results = coordinator.fetchAll("ACME", List.of(hung, quick));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(elapsedMs).isLessThan(5_000);
        assertThat(results.value(quick)).isEqualTo("ok");
        assertThat(results.value(hung)).isNull();
        assertThat(results.outcome(hung).error()).isInstanceOf(TimeoutException.class);
    }

    @Test
    void timedOutTaskIsInterruptedAndFreesItsThread() throws Exception {
        ParallelFetchCoordinator single = singleThreadCoordinator();
        try {
            CountDownLatch interrupted = new CountDownLatch(1);
            FetchTask<String> hung = FetchTask.optional("hung", () -> {
                try {
                    Thread.sleep(30_000);
                    return "late";
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                    return null;
                }
            });

            FetchResults first = single.fetchAll("ACME", List.of(hung));
            assertThat(first.outcome(hung).error()).isInstanceOf(TimeoutException.class);
            assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();

            FetchTask<String> next = FetchTask.optional("next", () -> "ok");
            FetchResults second = single.fetchAll("ACME", List.of(next));
            assertThat(second.value(next)).isEqualTo("ok");
        } finally {
            single.shutdown();
        }
    }

    @Test
    void taskIgnoringInterruptsDoesNotStarveLaterRequests() {
        ParallelFetchCoordinator single = singleThreadCoordinator();
        try {
            FetchTask<String> stubborn = FetchTask.optional("stubborn", () -> {
                long until = System.nanoTime() + TimeUnit.SECONDS.toNanos(4);
                while (System.nanoTime() < until) {
                    Thread.onSpinWait();
                }
                return "late";
            });
            single.fetchAll("ACME", List.of(stubborn));

            // The stubborn worker still holds the only warm thread here
            FetchTask<String> next = FetchTask.optional("next", () -> "ok");
            FetchResults second = single.fetchAll("ACME", List.of(next));

            assertThat(second.value(next)).isEqualTo("ok");
            assertThat(second.failedCount()).isZero();
        } finally {
            single.shutdown();
        }
    }

    @Test
    void unknownTaskIsRejected() {
        FetchResults results = coordinator.fetchAll("ACME", List.of(FetchTask.optional("a", () -> "a")));

        assertThatThrownBy(() -> results.value(FetchTask.optional("other", () -> "b")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static ParallelFetchCoordinator singleThreadCoordinator() {
        InsightConfig config = new InsightConfig("insight.yaml", new MockEnvironment());
        config.fetch().setPoolSize(1);
        config.fetch().setTimeoutSeconds(1);
        return new ParallelFetchCoordinator(config);
    }

    private static boolean awaitLatch(CountDownLatch latch) {
        latch.countDown();
        try {
            return latch.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
