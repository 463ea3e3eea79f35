package com.segym.core.sampler;

import com.segym.core.llm.ModelClient;
import com.segym.core.llm.ModelRequest;
import com.segym.core.llm.ModelTransportException;
import com.segym.core.llm.RateLimitException;
import com.segym.core.llm.SchemaValidationException;
import com.segym.core.metrics.SegymMetrics;
import com.segym.core.model.Action;
import com.segym.core.model.Genome;
import com.segym.core.model.Observation;
import com.segym.core.model.PatchProposal;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class LlmSamplerTest {

    private static final String VALID = """
            {"filename": " calc.py ", "oldCode": "return a - b", "newCode": "return a + b"}
            """;

    private final Genome genome = Genome.initial(2, "You are a careful engineer.");
    private final Observation observation = new Observation("### calc.py\nreturn a - b", List.of("calc.py"), false);

    private ModelClient modelClient;
    private List<Duration> sleeps;
    private SimpleMeterRegistry registry;
    private LlmSampler sampler;

    @BeforeEach
    void setUp() {
        modelClient = mock(ModelClient.class);
        sleeps = new ArrayList<>();
        registry = new SimpleMeterRegistry();
        var policy = new RetryPolicy(3, Duration.ofMillis(100), 2.0, Duration.ofSeconds(1));
        sampler = new LlmSampler(modelClient, policy, sleeps::add, new SegymMetrics(registry));
    }

    @Test
    @DisplayName("turns a valid response into an edit action for the genome")
    void validResponse() {
        when(modelClient.complete(any())).thenReturn(VALID);

        Action action = sampler.sample(observation, genome);

        assertEquals("G0-002", action.genomeId());
        assertEquals("calc.py", action.filename());
        assertEquals("return a - b", action.oldCode());
        assertEquals("return a + b", action.newCode());
        assertFalse(action.noop());
        assertFalse(action.degraded());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("uses the genome prompt as system prompt and the observation as user prompt")
    @SuppressWarnings({"rawtypes", "unchecked"})
    void promptRouting() {
        when(modelClient.complete(any())).thenReturn(VALID);

        sampler.sample(observation, genome);

        ArgumentCaptor<ModelRequest> captor = ArgumentCaptor.forClass(ModelRequest.class);
        verify(modelClient).complete(captor.capture());
        assertEquals("You are a careful engineer.", captor.getValue().systemPrompt());
        assertTrue(captor.getValue().userPrompt().endsWith(observation.text()));
        assertEquals(PatchProposal.class, captor.getValue().outputType());
    }

    @Test
    @DisplayName("retries transient failures with backoff, then succeeds")
    void retriesThenSucceeds() {
        when(modelClient.complete(any()))
                .thenThrow(new RateLimitException("429", null))
                .thenReturn("not json")
                .thenReturn(VALID);

        Action action = sampler.sample(observation, genome);

        assertFalse(action.noop());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
        verify(modelClient, times(3)).complete(any());
    }

    @Test
    @DisplayName("degrades to a no-op when every attempt fails")
    void degradesAfterExhaustion() {
        when(modelClient.complete(any())).thenThrow(new ModelTransportException("down", null));

        Action action = sampler.sample(observation, genome);

        assertTrue(action.noop());
        assertTrue(action.degraded());
        assertEquals("G0-002", action.genomeId());
        verify(modelClient, times(3)).complete(any());
        assertEquals(2, sleeps.size());
        assertEquals(1.0, registry.counter("segym.sampler.degraded", "reason", "ModelTransportException").count());
    }

    @Test
    @DisplayName("a proposal without filename is retried as a schema violation")
    void missingFilename() {
        when(modelClient.complete(any())).thenReturn("{\"oldCode\": \"x\", \"newCode\": \"y\"}");

        Action action = sampler.sample(observation, genome);

        assertTrue(action.degraded());
        verify(modelClient, times(3)).complete(any());
    }

    @Test
    @DisplayName("interruption during backoff stops retrying")
    void interruptedBackoff() {
        when(modelClient.complete(any())).thenThrow(new ModelTransportException("down", null));
        var interrupting = new LlmSampler(modelClient, new RetryPolicy(3, Duration.ofMillis(1), 1.0, Duration.ofMillis(1)),
                d -> { throw new InterruptedException(); }, null);

        Action action = interrupting.sample(observation, genome);

        assertTrue(action.degraded());
        verify(modelClient, times(1)).complete(any());
        assertTrue(Thread.interrupted());
    }

    @Test
    void validateRejectsMissingNewCode() {
        assertThrows(SchemaValidationException.class,
                () -> LlmSampler.validate(new PatchProposal("calc.py", "x", null)));
        assertThrows(SchemaValidationException.class,
                () -> LlmSampler.validate(new PatchProposal(" ", "x", "y")));
        assertDoesNotThrow(() -> LlmSampler.validate(new PatchProposal("calc.py", null, "")));
    }
}
