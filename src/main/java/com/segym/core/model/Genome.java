package com.segym.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * One candidate repair prompt and its lineage.
 *
 * @param id         unique identifier, stable for elites carried across generations
 * @param prompt     the system prompt handed to the sampler
 * @param generation generation in which this genome was created (0 = initial population)
 * @param parentIds  ids of the genomes this one was bred from (empty for the initial population)
 */
public record Genome(
    String id,
    String prompt,
    int generation,
    List<String> parentIds
) implements Serializable {

    public Genome {
        parentIds = parentIds != null ? List.copyOf(parentIds) : List.of();
    }

    public static Genome initial(int index, String prompt) {
        return new Genome(idFor(0, index), prompt, 0, List.of());
    }

    public static String idFor(int generation, int index) {
        return "G%d-%03d".formatted(generation, index);
    }
}
