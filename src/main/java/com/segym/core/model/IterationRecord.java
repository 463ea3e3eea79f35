package com.segym.core.model;

import java.util.List;

/**
 * Everything one time-step of the repair loop produced, index-aligned by genome.
 *
 * @param iteration  loop iteration (one reset per iteration)
 * @param timeStep   time-step within the iteration
 * @param generation population generation that was sampled
 * @param genomes    genomes that were sampled
 * @param actions    action proposed by each genome
 * @param states     state each action produced
 * @param rewards    fitness of each state
 * @param degraded   true when at least one sampler call fell back to a no-op
 */
public record IterationRecord(
    int iteration,
    int timeStep,
    int generation,
    List<Genome> genomes,
    List<Action> actions,
    List<State> states,
    List<Double> rewards,
    boolean degraded
) {

    public IterationRecord {
        genomes = List.copyOf(genomes);
        actions = List.copyOf(actions);
        states = List.copyOf(states);
        rewards = List.copyOf(rewards);
    }
}
