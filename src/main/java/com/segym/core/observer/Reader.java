package com.segym.core.observer;

import com.segym.core.model.State;

import java.util.SortedMap;

/**
 * Decides which files of a state's working tree go into an observation.
 */
public interface Reader {

    /**
     * @return file contents keyed by path relative to the project root, in a deterministic order
     */
    SortedMap<String, String> read(State state);
}
