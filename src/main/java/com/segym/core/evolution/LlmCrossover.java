package com.segym.core.evolution;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.segym.core.llm.ModelClient;
import com.segym.core.llm.ModelRequest;
import com.segym.core.llm.SamplerException;
import com.segym.core.llm.StructuredOutputParser;
import com.segym.core.model.Genome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * Asks a language model to combine two parent prompts. The model returns two children and
 * one of them is picked at random. Falls back to {@link SegmentCrossover} when the call or
 * its output fails.
 */
public class LlmCrossover implements CrossoverOperator {

    private static final Logger log = LoggerFactory.getLogger(LlmCrossover.class);

    static final String SYSTEM_PROMPT = """
            You are a prompt engineer.
            You are improving two prompts (instructions for a program-repair assistant) with a \
            genetic algorithm by performing a crossover operation: you combine two prompts to \
            create two new prompts.
            %s
            The parent prompts received fitness scores of %s and %s respectively.
            Extract the best parts of the two parent prompts and combine them in a way that \
            improves the overall quality.
            The child prompts should be similar to the parent prompts, but not identical, and \
            they should differ from each other.
            """;

    static final String USER_PROMPT = """
            The first prompt with a fitness score of %s is:
            =======================================================
            %s
            =======================================================

            The second prompt with a fitness score of %s is:
            =======================================================
            %s
            =======================================================

            Based on the parent prompts, create two new prompts that are similar to the parent \
            prompts but not identical.
            """;

    public record Children(
        @JsonPropertyDescription("First child prompt") String child1,
        @JsonPropertyDescription("Second child prompt") String child2
    ) {}

    private final ModelClient modelClient;
    private final SelectionDirection direction;
    private final CrossoverOperator fallback;

    public LlmCrossover(ModelClient modelClient, SelectionDirection direction, CrossoverOperator fallback) {
        this.modelClient = modelClient;
        this.direction = direction;
        this.fallback = fallback;
    }

    public LlmCrossover(ModelClient modelClient, SelectionDirection direction) {
        this(modelClient, direction, new SegmentCrossover());
    }

    @Override
    public String crossover(Genome first, double firstReward, Genome second, double secondReward, Random random) {
        var request = new ModelRequest<>(
                SYSTEM_PROMPT.formatted(objective(direction), firstReward, secondReward),
                USER_PROMPT.formatted(firstReward, first.prompt(), secondReward, second.prompt()),
                Children.class);
        try {
            Children children = StructuredOutputParser.parse(modelClient.complete(request), Children.class);
            String picked = random.nextBoolean() ? children.child1() : children.child2();
            if (picked == null || picked.isBlank()) {
                picked = children.child1() != null && !children.child1().isBlank() ? children.child1() : children.child2();
            }
            if (picked != null && !picked.isBlank()) {
                return picked.trim();
            }
            log.warn("LLM crossover of {} and {} returned no usable child", first.id(), second.id());
        } catch (SamplerException e) {
            log.warn("LLM crossover of {} and {} failed: {}", first.id(), second.id(), e.getMessage());
        }
        return fallback.crossover(first, firstReward, second, secondReward, random);
    }

    static String objective(SelectionDirection direction) {
        return direction == SelectionDirection.MINIMIZE
                ? "Fitness is the number of failing tests after applying the assistant's patch; lower is better."
                : "Higher fitness is better.";
    }
}
