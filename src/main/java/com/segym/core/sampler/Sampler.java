package com.segym.core.sampler;

import com.segym.core.model.Action;
import com.segym.core.model.Genome;
import com.segym.core.model.Observation;

/**
 * Turns a genome's prompt plus an observation into one patch proposal.
 * <p>
 * Implementations must be safe to call concurrently for many genomes of the same step
 * and must never throw for transient model failures: they degrade to a no-op action instead.
 */
public interface Sampler {

    Action sample(Observation observation, Genome genome);
}
