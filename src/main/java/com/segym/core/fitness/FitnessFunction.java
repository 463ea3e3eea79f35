package com.segym.core.fitness;

import com.segym.core.evolution.SelectionDirection;
import com.segym.core.model.State;

/**
 * Maps a post-step state to a scalar reward. Implementations must be pure and total:
 * every reachable state, including maximal-failure states, gets a well-defined score.
 */
public interface FitnessFunction {

    double score(State state);

    /** Whether the population should prefer lower or higher scores. */
    SelectionDirection direction();
}
