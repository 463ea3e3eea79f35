package com.segym.core.evolution;

import java.util.Random;

/**
 * Perturbs a prompt. Implementations must return text that differs from the input.
 */
public interface MutationOperator {

    String mutate(String prompt, double reward, Random random);
}
