package com.segym.core.evolution;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.segym.core.llm.ModelClient;
import com.segym.core.llm.ModelRequest;
import com.segym.core.llm.SamplerException;
import com.segym.core.llm.StructuredOutputParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * Asks a language model to rewrite a prompt. Falls back to {@link SentenceMutation} when the
 * call fails or the model returns the prompt unchanged.
 */
public class LlmMutation implements MutationOperator {

    private static final Logger log = LoggerFactory.getLogger(LlmMutation.class);

    static final String SYSTEM_PROMPT = """
            You are a prompt engineer.
            You are improving a prompt (instructions for a program-repair assistant) with a \
            genetic algorithm by performing a mutation operation: you modify the prompt to \
            create a new prompt.
            %s
            The parent prompt received a fitness score of %s.
            Make major changes to the parent prompt that improve the overall quality.
            The child prompt should be similar to the parent prompt, but not identical.
            """;

    static final String USER_PROMPT = """
            The parent prompt with a fitness score of %s is:
            =======================================================
            %s
            =======================================================
            Based on the parent prompt, create a new prompt that is similar to the parent prompt \
            but not identical.
            """;

    public record Child(
        @JsonPropertyDescription("The mutated prompt") String child
    ) {}

    private final ModelClient modelClient;
    private final SelectionDirection direction;
    private final MutationOperator fallback;

    public LlmMutation(ModelClient modelClient, SelectionDirection direction, MutationOperator fallback) {
        this.modelClient = modelClient;
        this.direction = direction;
        this.fallback = fallback;
    }

    public LlmMutation(ModelClient modelClient, SelectionDirection direction) {
        this(modelClient, direction, new SentenceMutation());
    }

    @Override
    public String mutate(String prompt, double reward, Random random) {
        var request = new ModelRequest<>(
                SYSTEM_PROMPT.formatted(LlmCrossover.objective(direction), reward),
                USER_PROMPT.formatted(reward, prompt),
                Child.class);
        try {
            Child child = StructuredOutputParser.parse(modelClient.complete(request), Child.class);
            if (child.child() != null && !child.child().isBlank() && !child.child().trim().equals(prompt.trim())) {
                return child.child().trim();
            }
            log.warn("LLM mutation returned an empty or unchanged prompt");
        } catch (SamplerException e) {
            log.warn("LLM mutation failed: {}", e.getMessage());
        }
        return fallback.mutate(prompt, reward, random);
    }
}
