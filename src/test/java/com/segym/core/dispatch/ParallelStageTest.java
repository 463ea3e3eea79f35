package com.segym.core.dispatch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ParallelStageTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        MDC.clear();
    }

    @Test
    @DisplayName("results keep input order even when later slots finish first")
    void preservesOrder() {
        var stage = new ParallelStage("test", executor, Duration.ofSeconds(5));

        List<String> results = stage.map(List.of(300, 10, 150, 0), (i, delay) -> {
            Thread.sleep(delay);
            return "slot-" + i;
        }, (i, delay, cause) -> "fallback");

        assertEquals(List.of("slot-0", "slot-1", "slot-2", "slot-3"), results);
    }

    @Test
    @DisplayName("a failing task resolves to the fallback with its cause")
    void failureFallsBack() {
        var stage = new ParallelStage("test", executor, Duration.ofSeconds(5));

        List<String> results = stage.map(List.of("ok", "bad", "ok"), (i, input) -> {
            if (input.equals("bad")) {
                throw new IllegalArgumentException("bad input");
            }
            return input;
        }, (i, input, cause) -> "fallback:" + cause.getMessage());

        assertEquals(List.of("ok", "fallback:bad input", "ok"), results);
    }

    @Test
    @DisplayName("tasks running past the deadline are cancelled")
    void deadlineCancels() {
        var stage = new ParallelStage("test", executor, Duration.ofMillis(200));
        var interrupted = new AtomicBoolean(false);

        long start = System.nanoTime();
        List<String> results = stage.map(List.of("slow", "fast"), (i, input) -> {
            if (input.equals("slow")) {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    interrupted.set(true);
                    throw e;
                }
            }
            return input;
        }, (i, input, cause) -> cause instanceof TimeoutException ? "timeout" : "other");

        assertTrue(Duration.ofNanos(System.nanoTime() - start).toSeconds() < 5);
        assertEquals(List.of("timeout", "fast"), results);
    }

    @Test
    @DisplayName("worker threads inherit the caller's MDC")
    void propagatesMdc() {
        var stage = new ParallelStage("test", executor, Duration.ofSeconds(5));
        MDC.put("runId", "SEGYM-2026-0007");

        List<String> results = stage.map(List.of(1, 2), (i, input) -> MDC.get("runId"), (i, input, cause) -> null);

        assertEquals(List.of("SEGYM-2026-0007", "SEGYM-2026-0007"), results);
    }

    @Test
    void emptyInput() {
        var stage = new ParallelStage("test", executor, Duration.ofSeconds(1));

        assertTrue(stage.<String, String>map(List.of(), (i, s) -> s, (i, s, c) -> s).isEmpty());
    }
}
