package com.segym.core.evolution;

import com.segym.core.model.Genome;

import java.util.Random;

/**
 * Combines two parent prompts into one child prompt.
 */
public interface CrossoverOperator {

    String crossover(Genome first, double firstReward, Genome second, double secondReward, Random random);
}
