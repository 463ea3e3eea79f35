package com.segym.sandbox;

import com.segym.core.model.Action;
import com.segym.core.model.State;

import java.util.List;

/**
 * Runs the project's test suite against candidate edits.
 *
 * <p>Failures inside a sandbox never escape: they come back as maximal-failure
 * {@link State}s.
 */
public interface Environment {

    /**
     * Runs the tests on the unmodified tree and starts a new epoch.
     */
    State reset();

    /**
     * Applies each action to its own copy of the tree and runs the tests there.
     *
     * @return one state per action, in the same order
     * @throws com.segym.core.ConfigurationException when called before {@link #reset()}
     */
    List<State> step(List<Action> actions);
}
