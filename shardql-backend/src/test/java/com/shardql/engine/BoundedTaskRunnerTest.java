package com.shardql.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class BoundedTaskRunnerTest {
    private ExecutorService workers;
    private BoundedTaskRunner runner;

    @BeforeEach
    void setUp() {
        workers = Executors.newFixedThreadPool(8);
        runner = new BoundedTaskRunner(workers);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        MDC.clear();
    }

    @Test
    void neverExceedsConcurrencyEvenWithLargerPool() {
        List<Integer> inputs = IntStream.range(0, 20).boxed().collect(Collectors.toList());
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<Integer> completed = new ArrayList<>();

        runner.<Integer, Integer>run(inputs, 3, input -> {
            int now = inFlight.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            Thread.sleep(15);
            inFlight.decrementAndGet();
            return input * 2;
        }, (input, result, error) -> {
            assertThat(error).isNull();
            assertThat(result).isEqualTo(input * 2);
            completed.add(input);
        });

        assertThat(peak.get()).isBetween(1, 3);
        assertThat(completed).containsExactlyInAnyOrderElementsOf(inputs);
    }

    @Test
    void concurrencyOfOneRunsSerially() {
        List<Integer> order = new ArrayList<>();

        runner.<Integer, Integer>run(List.of(1, 2, 3, 4), 1, input -> input,
                (input, result, error) -> order.add(result));

        assertThat(order).containsExactly(1, 2, 3, 4);
    }

    @Test
    void deliversCompletionsInCompletionOrder() {
        List<String> order = new ArrayList<>();

        runner.<String, String>run(List.of("slow", "fast"), 2, input -> {
            Thread.sleep(input.equals("slow") ? 200 : 1);
            return input;
        }, (input, result, error) -> order.add(input));

        assertThat(order).containsExactly("fast", "slow");
    }

    @Test
    void failingTaskDoesNotAffectSiblings() {
        Map<String, Throwable> errors = new ConcurrentHashMap<>();
        Map<String, String> results = new ConcurrentHashMap<>();

        runner.<String, String>run(List.of("a", "boom", "c"), 2, input -> {
            if (input.equals("boom")) {
                throw new IllegalStateException("exploded");
            }
            return input.toUpperCase();
        }, (input, result, error) -> {
            if (error != null) {
                errors.put(input, error);
            } else {
                results.put(input, result);
            }
        });

        assertThat(results).containsOnly(Map.entry("a", "A"), Map.entry("c", "C"));
        assertThat(errors).containsOnlyKeys("boom");
        assertThat(errors.get("boom")).isInstanceOf(IllegalStateException.class).hasMessage("exploded");
    }

    @Test
    void rejectedSubmissionsStillComplete() {
        ExecutorService closed = Executors.newSingleThreadExecutor();
        closed.shutdown();
        BoundedTaskRunner closedRunner = new BoundedTaskRunner(closed);
        List<Throwable> errors = new ArrayList<>();

        closedRunner.<String, String>run(List.of("a", "b"), 2, input -> input,
                (input, result, error) -> errors.add(error));

        assertThat(errors).hasSize(2).allSatisfy(e -> assertThat(e).isInstanceOf(RejectedExecutionException.class));
    }

    @Test
    void emptyInputCompletesImmediately() {
        AtomicInteger calls = new AtomicInteger();

        runner.<String, String>run(List.of(), 4, input -> input, (input, result, error) -> calls.incrementAndGet());

        assertThat(calls).hasValue(0);
    }

    @Test
    void propagatesMdcIntoWorkers() {
        MDC.put("trace_id", "trace-123");
        Map<String, String> seen = new ConcurrentHashMap<>();

        runner.<String, String>run(List.of("a", "b", "c"), 2, input -> MDC.get("trace_id"),
                (input, result, error) -> seen.put(input, result));

        assertThat(seen).containsOnly(Map.entry("a", "trace-123"), Map.entry("b", "trace-123"), Map.entry("c", "trace-123"));
    }

    @Test
    void interruptedCallerReportsOutstandingInputsAsFailed() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        Map<String, Throwable> outcomes = new ConcurrentHashMap<>();
        CountDownLatch started = new CountDownLatch(1);

        Thread caller = new Thread(() -> runner.<String, String>run(List.of("a", "b", "c"), 1, input -> {
            started.countDown();
            release.await();
            return input;
        }, (input, result, error) -> outcomes.put(input, error)));
        caller.start();

        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        caller.interrupt();
        caller.join(5000);
        release.countDown();

        assertThat(caller.isAlive()).isFalse();
        assertThat(outcomes).containsOnlyKeys("a", "b", "c");
        assertThat(outcomes.values()).allSatisfy(e ->
                assertThat(e).hasMessage("Interrupted before the task completed"));
    }
}
