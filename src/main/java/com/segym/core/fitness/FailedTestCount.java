package com.segym.core.fitness;

import com.segym.core.evolution.SelectionDirection;
import com.segym.core.model.State;
import org.springframework.stereotype.Component;

/**
 * Counts failing and erroring tests in the state's report. Lower is better.
 */
@Component
public class FailedTestCount implements FitnessFunction {

    @Override
    public double score(State state) {
        if (state == null || state.report() == null) {
            throw new IllegalArgumentException("State without a test report cannot be scored");
        }
        return Math.max(0, state.report().failingCount());
    }

    @Override
    public SelectionDirection direction() {
        return SelectionDirection.MINIMIZE;
    }
}
