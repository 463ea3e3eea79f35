package com.segym.core.evolution;

import com.segym.core.ConfigurationException;

import java.time.Duration;

/**
 * Genetic-algorithm parameters. Invalid values are rejected, never clamped.
 *
 * @param eliteSize      genomes carried over unmodified each generation
 * @param mutationRate   probability that an offspring is mutated, in [0, 1]
 * @param crossoverRate  probability that an offspring is bred from two parents, in [0, 1]
 * @param direction      whether lower or higher rewards are better
 * @param maxParallel    concurrent sampler calls
 * @param sampleDeadline time budget for one sampling round
 */
public record EvolutionSettings(
    int eliteSize,
    double mutationRate,
    double crossoverRate,
    SelectionDirection direction,
    int maxParallel,
    Duration sampleDeadline
) {

    public EvolutionSettings {
        if (eliteSize < 0) {
            throw new ConfigurationException("eliteSize must not be negative, got " + eliteSize);
        }
        requireRate("mutationRate", mutationRate);
        requireRate("crossoverRate", crossoverRate);
        if (direction == null) {
            throw new ConfigurationException("selection direction is required");
        }
        if (maxParallel < 1) {
            throw new ConfigurationException("maxParallel must be at least 1, got " + maxParallel);
        }
        if (sampleDeadline == null || sampleDeadline.isZero() || sampleDeadline.isNegative()) {
            throw new ConfigurationException("sampleDeadline must be positive");
        }
    }

    public static EvolutionSettings of(int eliteSize, double mutationRate, double crossoverRate) {
        return new EvolutionSettings(eliteSize, mutationRate, crossoverRate,
                SelectionDirection.MINIMIZE, 4, Duration.ofMinutes(10));
    }

    private static void requireRate(String name, double rate) {
        if (Double.isNaN(rate) || rate < 0.0 || rate > 1.0) {
            throw new ConfigurationException(name + " must be within [0, 1], got " + rate);
        }
    }
}
