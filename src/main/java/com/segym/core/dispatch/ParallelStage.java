package com.segym.core.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fan-out/fan-in stage: runs one task per input on a bounded executor and collects the
 * results in input order.
 *
 * <p>All tasks share a single deadline. Tasks still running when it elapses are cancelled
 * (interrupted) and their slot resolves to the fallback, as does any task that throws.
 * The returned list always has the same size as the input and element {@code i} always
 * belongs to input {@code i}.
 */
public class ParallelStage {

    private static final Logger log = LoggerFactory.getLogger(ParallelStage.class);

    /** Work for one slot. */
    @FunctionalInterface
    public interface SlotTask<T, R> {
        R apply(int index, T input) throws Exception;
    }

    /** Value for a slot whose task failed, was cancelled, or missed the deadline. */
    @FunctionalInterface
    public interface SlotFallback<T, R> {
        R apply(int index, T input, Throwable cause);
    }

    private final String name;
    private final ExecutorService executor;
    private final Duration deadline;

    public ParallelStage(String name, ExecutorService executor, Duration deadline) {
        this.name = name;
        this.executor = executor;
        this.deadline = deadline;
    }

    public <T, R> List<R> map(List<T> inputs, SlotTask<T, R> task, SlotFallback<T, R> fallback) {
        if (inputs.isEmpty()) {
            return List.of();
        }
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        var futures = new ArrayList<Future<R>>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            final int index = i;
            final T input = inputs.get(i);
            futures.add(executor.submit(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    return task.apply(index, input);
                } finally {
                    MDC.clear();
                }
            }));
        }

        long deadlineNanos = System.nanoTime() + deadline.toNanos();
        var results = new ArrayList<R>(inputs.size());
        for (int i = 0; i < futures.size(); i++) {
            var future = futures.get(i);
            T input = inputs.get(i);
            try {
                long remaining = Math.max(0, deadlineNanos - System.nanoTime());
                results.add(future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("{} slot {} missed the {}s deadline, cancelled", name, i, deadline.toSeconds());
                results.add(fallback.apply(i, input, e));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("{} slot {} failed: {}", name, i, cause.getMessage(), cause);
                results.add(fallback.apply(i, input, cause));
            } catch (CancellationException e) {
                results.add(fallback.apply(i, input, e));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                for (int j = i; j < futures.size(); j++) {
                    futures.get(j).cancel(true);
                }
                for (int j = i; j < futures.size(); j++) {
                    results.add(fallback.apply(j, inputs.get(j), e));
                }
                log.warn("{} interrupted, {} slot(s) resolved to fallback", name, futures.size() - i);
                return results;
            }
        }
        return results;
    }
}
