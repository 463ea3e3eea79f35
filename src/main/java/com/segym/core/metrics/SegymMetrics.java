package com.segym.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the repair loop.
 */
@Service
public class SegymMetrics {

    private final MeterRegistry registry;

    public SegymMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSamplerCall(long ms, int attempts) {
        Timer.builder("segym.sampler.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
        DistributionSummary.builder("segym.sampler.attempts")
                .register(registry)
                .record(attempts);
    }

    /**
     * Records a sampler call that exhausted its retries and fell back to a no-op.
     *
     * @param reason simple name of the last failure
     */
    public void recordSamplerDegraded(String reason) {
        Counter.builder("segym.sampler.degraded")
                .description("Sampler calls that fell back to a no-op action")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "passed", "failed", "malformed", "timeout" or "error"
     */
    public void recordSandboxRun(String outcome, long ms) {
        Timer.builder("segym.sandbox.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGeneration(double bestReward) {
        Counter.builder("segym.generations.total")
                .register(registry)
                .increment();
        DistributionSummary.builder("segym.generation.best_reward")
                .description("Best reward observed per evaluated generation")
                .register(registry)
                .record(bestReward);
    }
}
