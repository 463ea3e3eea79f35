package com.segym.core.observer;

import com.segym.core.model.Observation;

import java.util.SortedMap;

/**
 * Reduces the files a {@link Reader} produced to a single bounded observation.
 */
public interface Selector {

    Observation select(SortedMap<String, String> files);
}
