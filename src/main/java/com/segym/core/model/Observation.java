package com.segym.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Bounded code context extracted from a state for one sampling round.
 *
 * @param text      rendered context handed to the sampler
 * @param files     relative paths included, in rendering order
 * @param truncated true when content was cut to fit the size budget
 */
public record Observation(
    String text,
    List<String> files,
    boolean truncated
) implements Serializable {

    public Observation {
        files = files != null ? List.copyOf(files) : List.of();
        text = text != null ? text : "";
    }
}
