package com.segym.core.evolution;

import com.segym.core.llm.ModelClient;
import com.segym.core.llm.ModelRequest;
import com.segym.core.llm.ModelTransportException;
import com.segym.core.llm.RateLimitException;
import com.segym.core.model.Genome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link LlmCrossover} and {@link LlmMutation} with a mocked {@link ModelClient}.
 */
class LlmOperatorsTest {

    private ModelClient modelClient;
    private CrossoverOperator crossoverFallback;
    private MutationOperator mutationFallback;

    private final Genome first = Genome.initial(0, "Fix the bug.");
    private final Genome second = Genome.initial(1, "Read the test first.");

    @BeforeEach
    void setUp() {
        modelClient = mock(ModelClient.class);
        crossoverFallback = mock(CrossoverOperator.class);
        mutationFallback = mock(MutationOperator.class);
        when(crossoverFallback.crossover(any(), anyDouble(), any(), anyDouble(), any())).thenReturn("fallback child");
        when(mutationFallback.mutate(anyString(), anyDouble(), any())).thenReturn("fallback mutant");
    }

    @Nested
    @DisplayName("LlmCrossover")
    class Crossover {

        @Test
        @DisplayName("returns one of the children the model produced")
        void picksChild() {
            when(modelClient.complete(any())).thenReturn("""
                    {"child1": "Fix the bug after reading the test.", "child2": "Read the test, then fix the bug."}
                    """);
            var op = new LlmCrossover(modelClient, SelectionDirection.MINIMIZE, crossoverFallback);

            String child = op.crossover(first, 2.0, second, 1.0, new Random(1));

            assertTrue(child.equals("Fix the bug after reading the test.") || child.equals("Read the test, then fix the bug."));
            verifyNoInteractions(crossoverFallback);
        }

        @Test
        @DisplayName("puts both parents and their rewards into the request")
        @SuppressWarnings({"rawtypes", "unchecked"})
        void requestContents() {
            when(modelClient.complete(any())).thenReturn("{\"child1\": \"a\", \"child2\": \"b\"}");
            var op = new LlmCrossover(modelClient, SelectionDirection.MINIMIZE, crossoverFallback);

            op.crossover(first, 2.0, second, 1.0, new Random(1));

            ArgumentCaptor<ModelRequest> captor = ArgumentCaptor.forClass(ModelRequest.class);
            verify(modelClient).complete(captor.capture());
            ModelRequest<?> request = captor.getValue();
            assertTrue(request.userPrompt().contains("Fix the bug."));
            assertTrue(request.userPrompt().contains("Read the test first."));
            assertTrue(request.systemPrompt().contains("lower is better"));
            assertEquals(LlmCrossover.Children.class, request.outputType());
        }

        @Test
        @DisplayName("uses the other child when the picked one is blank")
        void blankChild() {
            when(modelClient.complete(any())).thenReturn("{\"child1\": \"  \", \"child2\": \"Only child.\"}");
            var op = new LlmCrossover(modelClient, SelectionDirection.MINIMIZE, crossoverFallback);

            for (long seed = 0; seed < 5; seed++) {
                assertEquals("Only child.", op.crossover(first, 2.0, second, 1.0, new Random(seed)));
            }
        }

        @Test
        @DisplayName("falls back when the model call fails")
        void fallsBackOnFailure() {
            when(modelClient.complete(any())).thenThrow(new RateLimitException("429", null));
            var op = new LlmCrossover(modelClient, SelectionDirection.MINIMIZE, crossoverFallback);

            assertEquals("fallback child", op.crossover(first, 2.0, second, 1.0, new Random(1)));
        }

        @Test
        @DisplayName("falls back when the output is not JSON")
        void fallsBackOnJunk() {
            when(modelClient.complete(any())).thenReturn("I would rather not.");
            var op = new LlmCrossover(modelClient, SelectionDirection.MINIMIZE, crossoverFallback);

            assertEquals("fallback child", op.crossover(first, 2.0, second, 1.0, new Random(1)));
        }
    }

    @Nested
    @DisplayName("LlmMutation")
    class Mutation {

        @Test
        @DisplayName("returns the rewritten prompt")
        void rewrites() {
            when(modelClient.complete(any())).thenReturn("```json\n{\"child\": \"Repair the defect.\"}\n```");
            var op = new LlmMutation(modelClient, SelectionDirection.MINIMIZE, mutationFallback);

            assertEquals("Repair the defect.", op.mutate("Fix the bug.", 3.0, new Random(1)));
            verifyNoInteractions(mutationFallback);
        }

        @Test
        @DisplayName("falls back when the model returns the prompt unchanged")
        void unchanged() {
            when(modelClient.complete(any())).thenReturn("{\"child\": \"Fix the bug.\"}");
            var op = new LlmMutation(modelClient, SelectionDirection.MINIMIZE, mutationFallback);

            assertEquals("fallback mutant", op.mutate("Fix the bug.", 3.0, new Random(1)));
        }

        @Test
        @DisplayName("falls back on transport errors")
        void transportError() {
            when(modelClient.complete(any())).thenThrow(new ModelTransportException("down", null));
            var op = new LlmMutation(modelClient, SelectionDirection.MAXIMIZE, mutationFallback);

            assertEquals("fallback mutant", op.mutate("Fix the bug.", 3.0, new Random(1)));
        }

        @Test
        @DisplayName("default fallback still changes the prompt")
        void defaultFallback() {
            when(modelClient.complete(any())).thenThrow(new ModelTransportException("down", null));
            var op = new LlmMutation(modelClient, SelectionDirection.MINIMIZE);

            assertNotEquals("Fix the bug.", op.mutate("Fix the bug.", 3.0, new Random(1)));
        }
    }
}
