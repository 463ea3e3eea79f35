package com.segym.core.sampler;

import com.segym.core.ConfigurationException;

import java.time.Duration;

/**
 * Bounded retry with exponential backoff.
 *
 * @param maxAttempts    total attempts including the first, at least 1
 * @param initialBackoff wait before the second attempt
 * @param multiplier     growth factor applied per further attempt, at least 1.0
 * @param maxBackoff     upper bound for any single wait
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    double multiplier,
    Duration maxBackoff
) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new ConfigurationException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new ConfigurationException("initialBackoff must be zero or positive");
        }
        if (multiplier < 1.0) {
            throw new ConfigurationException("backoff multiplier must be >= 1.0, got " + multiplier);
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new ConfigurationException("maxBackoff must be >= initialBackoff");
        }
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /**
     * Wait after the given failed attempt (1-based) before the next one.
     */
    public Duration backoffAfter(int attempt) {
        double factor = Math.pow(multiplier, Math.max(0, attempt - 1));
        double millis = initialBackoff.toMillis() * factor;
        if (millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis((long) millis);
    }
}
