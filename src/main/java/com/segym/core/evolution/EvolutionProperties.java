package com.segym.core.evolution;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "segym.evolution")
public class EvolutionProperties {

    private List<String> initialPrompts = new ArrayList<>();
    private int eliteSize = 1;
    private double mutationRate = 0.2;
    private double crossoverRate = 0.7;
    private SelectionDirection direction = SelectionDirection.MINIMIZE;
    /** "text" or "llm". */
    private String operators = "text";
    /** Fixed seed for reproducible runs; random when unset. */
    private Long seed;
    private int maxParallel = 4;
    private int sampleDeadlineSeconds = 600;

    public List<String> getInitialPrompts() { return initialPrompts; }
    public void setInitialPrompts(List<String> initialPrompts) { this.initialPrompts = initialPrompts; }
    public int getEliteSize() { return eliteSize; }
    public void setEliteSize(int eliteSize) { this.eliteSize = eliteSize; }
    public double getMutationRate() { return mutationRate; }
    public void setMutationRate(double mutationRate) { this.mutationRate = mutationRate; }
    public double getCrossoverRate() { return crossoverRate; }
    public void setCrossoverRate(double crossoverRate) { this.crossoverRate = crossoverRate; }
    public SelectionDirection getDirection() { return direction; }
    public void setDirection(SelectionDirection direction) { this.direction = direction; }
    public String getOperators() { return operators; }
    public void setOperators(String operators) { this.operators = operators; }
    public Long getSeed() { return seed; }
    public void setSeed(Long seed) { this.seed = seed; }
    public int getMaxParallel() { return maxParallel; }
    public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
    public int getSampleDeadlineSeconds() { return sampleDeadlineSeconds; }
    public void setSampleDeadlineSeconds(int sampleDeadlineSeconds) { this.sampleDeadlineSeconds = sampleDeadlineSeconds; }

    public EvolutionSettings toSettings() {
        return new EvolutionSettings(eliteSize, mutationRate, crossoverRate, direction,
                maxParallel, Duration.ofSeconds(sampleDeadlineSeconds));
    }
}
