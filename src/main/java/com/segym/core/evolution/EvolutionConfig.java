package com.segym.core.evolution;

import com.segym.core.ConfigurationException;
import com.segym.core.llm.ModelClient;
import com.segym.core.sampler.Sampler;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class EvolutionConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService samplerExecutor(EvolutionProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getMaxParallel()));
    }

    @Bean
    public CrossoverOperator crossoverOperator(EvolutionProperties properties, ModelClient modelClient) {
        return switch (properties.getOperators().toLowerCase(Locale.ROOT)) {
            case "text" -> new SegmentCrossover();
            case "llm" -> new LlmCrossover(modelClient, properties.getDirection());
            default -> throw new ConfigurationException("Unknown operators: " + properties.getOperators());
        };
    }

    @Bean
    public MutationOperator mutationOperator(EvolutionProperties properties, ModelClient modelClient) {
        return switch (properties.getOperators().toLowerCase(Locale.ROOT)) {
            case "text" -> new SentenceMutation();
            case "llm" -> new LlmMutation(modelClient, properties.getDirection());
            default -> throw new ConfigurationException("Unknown operators: " + properties.getOperators());
        };
    }

    @Bean
    public Population population(EvolutionProperties properties, Sampler sampler,
                                 CrossoverOperator crossoverOperator, MutationOperator mutationOperator,
                                 @Qualifier("samplerExecutor") ExecutorService samplerExecutor) {
        Random random = properties.getSeed() != null ? new Random(properties.getSeed()) : new Random();
        return new Population(properties.getInitialPrompts(), sampler, properties.toSettings(),
                crossoverOperator, mutationOperator, random, samplerExecutor);
    }
}
