package com.segym.core.evolution;

import com.segym.core.model.Genome;

import java.util.ArrayList;
import java.util.Random;

/**
 * One-point crossover over sentence segments: a non-empty prefix of the first parent
 * followed by a non-empty suffix of the second.
 */
public class SegmentCrossover implements CrossoverOperator {

    @Override
    public String crossover(Genome first, double firstReward, Genome second, double secondReward, Random random) {
        var a = PromptSegments.split(first.prompt());
        var b = PromptSegments.split(second.prompt());
        int prefix = 1 + random.nextInt(a.size());
        int suffixStart = random.nextInt(b.size());

        var child = new ArrayList<String>(a.subList(0, prefix));
        for (String segment : b.subList(suffixStart, b.size())) {
            if (!child.contains(segment)) {
                child.add(segment);
            }
        }
        return PromptSegments.join(child);
    }
}
