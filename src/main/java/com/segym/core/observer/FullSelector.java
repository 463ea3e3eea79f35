package com.segym.core.observer;

import com.segym.core.model.Observation;

import java.util.ArrayList;
import java.util.SortedMap;

/**
 * Returns every file verbatim, in path order.
 */
public class FullSelector implements Selector {

    @Override
    public Observation select(SortedMap<String, String> files) {
        var text = new StringBuilder();
        for (var entry : files.entrySet()) {
            text.append(ObservationFormat.render(entry.getKey(), entry.getValue()));
        }
        return new Observation(text.toString(), new ArrayList<>(files.keySet()), false);
    }
}
