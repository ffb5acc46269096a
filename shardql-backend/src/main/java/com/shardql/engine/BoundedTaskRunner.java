package com.shardql.engine;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs one task per input on a shared worker pool with a per-call bound on tasks in flight.
 *
 * <p>Inputs are submitted through a sliding window: at most {@code concurrency} tasks of a call
 * are queued or running at any time, and the next input is submitted as soon as one finishes.
 * Completions are delivered on the calling thread in completion order, exactly once per input,
 * whether the task returned, threw, was rejected by the pool, or the caller was interrupted
 * while waiting. Tasks already running are never cancelled.
 */
@Slf4j
public class BoundedTaskRunner {

    /**
     * Work performed for one input on a worker thread.
     */
    @FunctionalInterface
    public interface Task<T, R> {
        R run(T input) throws Exception;
    }

    /**
     * Receives the completion of one input on the calling thread.
     */
    @FunctionalInterface
    public interface Completion<T, R> {
        /**
         * @param input the input the task ran for
         * @param result task result, null when {@code error} is set
         * @param error failure cause, null on success
         */
        void onComplete(T input, R result, Throwable error);
    }

    private final ExecutorService workers;

    public BoundedTaskRunner(ExecutorService workers) {
        this.workers = Objects.requireNonNull(workers, "workers");
    }

    /**
     * Runs {@code task} for every input and blocks until every input has completed.
     *
     * @param inputs inputs in submission order
     * @param concurrency maximum tasks of this call in flight, values below 1 are treated as 1
     * @param task work per input
     * @param completion completion callback, invoked once per input
     */
    public <T, R> void run(List<T> inputs, int concurrency, Task<T, R> task, Completion<T, R> completion) {
        if (inputs == null || inputs.isEmpty()) {
            return;
        }
        int limit = Math.max(1, concurrency);
        CompletionService<R> completionService = new ExecutorCompletionService<>(workers);
        Map<Future<R>, T> inFlight = new HashMap<>();
        Iterator<T> pending = inputs.iterator();
        Map<String, String> context = MDC.getCopyOfContextMap();

        fill(completionService, inFlight, pending, limit, task, completion, context);
        while (!inFlight.isEmpty()) {
            Future<R> done;
            try {
                done = completionService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandon(inFlight, pending, completion);
                return;
            }

            T input = inFlight.remove(done);
            R result = null;
            Throwable error = null;
            try {
                result = done.get();
            } catch (ExecutionException e) {
                error = e.getCause() != null ? e.getCause() : e;
            } catch (CancellationException e) {
                error = e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                error = e;
            }

            // Refill before handing the result over so the freed slot is not idle.
            fill(completionService, inFlight, pending, limit, task, completion, context);
            completion.onComplete(input, result, error);
        }
    }

    private <T, R> void fill(
            CompletionService<R> completionService,
            Map<Future<R>, T> inFlight,
            Iterator<T> pending,
            int limit,
            Task<T, R> task,
            Completion<T, R> completion,
            Map<String, String> context
    ) {
        while (inFlight.size() < limit && pending.hasNext()) {
            T input = pending.next();
            try {
                inFlight.put(completionService.submit(withContext(task, input, context)), input);
            } catch (RejectedExecutionException e) {
                log.warn("Worker pool rejected task for input={}", input);
                completion.onComplete(input, null, e);
            }
        }
    }

    private <T, R> void abandon(Map<Future<R>, T> inFlight, Iterator<T> pending, Completion<T, R> completion) {
        List<T> remaining = new ArrayList<>(inFlight.values());
        pending.forEachRemaining(remaining::add);
        inFlight.clear();
        log.warn("Interrupted while waiting for {} task(s); reporting them as failed", remaining.size());
        IllegalStateException cause = new IllegalStateException("Interrupted before the task completed");
        for (T input : remaining) {
            completion.onComplete(input, null, cause);
        }
    }

    private static <T, R> Callable<R> withContext(Task<T, R> task, T input, Map<String, String> context) {
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (context != null) {
                MDC.setContextMap(context);
            } else {
                MDC.clear();
            }
            try {
                return task.run(input);
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }
}
