package com.segym.core.sampler;

import com.segym.core.llm.ModelClient;
import com.segym.core.llm.ModelRequest;
import com.segym.core.llm.SamplerException;
import com.segym.core.llm.SchemaValidationException;
import com.segym.core.llm.StructuredOutputParser;
import com.segym.core.metrics.SegymMetrics;
import com.segym.core.model.Action;
import com.segym.core.model.Genome;
import com.segym.core.model.Observation;
import com.segym.core.model.PatchProposal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Sampler} that asks a language model for a {@link PatchProposal}.
 * <p>
 * The genome's prompt is the system prompt; the observation is the user prompt. Every
 * {@link SamplerException} (schema violation, transport error, rate limit) is retried under
 * the {@link RetryPolicy}. When attempts run out the genome gets a degraded no-op action.
 */
public class LlmSampler implements Sampler {

    private static final Logger log = LoggerFactory.getLogger(LlmSampler.class);

    static final String TASK_FRAMING = """
            The repository below has failing tests. Propose exactly one code change that \
            makes the failing tests pass without breaking passing ones.
            Copy oldCode verbatim from the file so it can be located, and give the full \
            replacement in newCode.

            """;

    private final ModelClient modelClient;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final SegymMetrics metrics;

    public LlmSampler(ModelClient modelClient, RetryPolicy retryPolicy, Sleeper sleeper, SegymMetrics metrics) {
        this.modelClient = modelClient;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    public LlmSampler(ModelClient modelClient, RetryPolicy retryPolicy) {
        this(modelClient, retryPolicy, Sleeper.SYSTEM, null);
    }

    @Override
    public Action sample(Observation observation, Genome genome) {
        var request = new ModelRequest<>(genome.prompt(), TASK_FRAMING + observation.text(), PatchProposal.class);
        long start = System.currentTimeMillis();
        SamplerException lastFailure = null;

        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            try {
                String raw = modelClient.complete(request);
                PatchProposal proposal = validate(StructuredOutputParser.parse(raw, PatchProposal.class));
                if (metrics != null) {
                    metrics.recordSamplerCall(System.currentTimeMillis() - start, attempt);
                }
                log.debug("Genome {} proposed an edit to {} (attempt {})", genome.id(), proposal.filename(), attempt);
                return Action.edit(genome.id(), proposal.filename().trim(), proposal.oldCode(), proposal.newCode());
            } catch (SamplerException e) {
                lastFailure = e;
                log.warn("Sampler attempt {}/{} for genome {} failed: {}",
                        attempt, retryPolicy.maxAttempts(), genome.id(), e.getMessage());
            }
            if (attempt < retryPolicy.maxAttempts()) {
                try {
                    sleeper.sleep(retryPolicy.backoffAfter(attempt));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Sampler for genome {} interrupted during backoff", genome.id());
                    break;
                }
            }
        }

        String reason = lastFailure != null ? lastFailure.getClass().getSimpleName() : "Interrupted";
        log.warn("Genome {} degraded to a no-op action after sampler failures ({})", genome.id(), reason);
        if (metrics != null) {
            metrics.recordSamplerDegraded(reason);
        }
        return Action.noop(genome.id(), true);
    }

    static PatchProposal validate(PatchProposal proposal) {
        if (proposal.filename() == null || proposal.filename().isBlank()) {
            throw new SchemaValidationException("PatchProposal.filename is required");
        }
        if (proposal.newCode() == null) {
            throw new SchemaValidationException("PatchProposal.newCode is required");
        }
        return proposal;
    }
}
