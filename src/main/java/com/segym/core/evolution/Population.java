package com.segym.core.evolution;

import com.segym.core.ConfigurationException;
import com.segym.core.dispatch.ParallelStage;
import com.segym.core.logging.MdcContext;
import com.segym.core.model.Action;
import com.segym.core.model.Genome;
import com.segym.core.model.Observation;
import com.segym.core.sampler.Sampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Fixed-size population of repair prompts evolved with a genetic algorithm.
 * <p>
 * Each generation is sampled once ({@link #sample}) and then replaced by its offspring
 * ({@link #evolve}). The best {@code eliteSize} genomes survive unchanged; the remaining
 * slots are filled by fitness-proportional selection followed by crossover and mutation.
 * The population size never changes.
 * <p>
 * {@code sample} and {@code evolve} are mutually exclusive: only one thread mutates the
 * population at a time.
 */
public class Population {

    private static final Logger log = LoggerFactory.getLogger(Population.class);

    private final Sampler sampler;
    private final EvolutionSettings settings;
    private final CrossoverOperator crossover;
    private final MutationOperator mutation;
    private final Random random;
    private final ParallelStage sampleStage;

    private volatile List<Genome> genomes;
    private volatile List<Double> lastRewards = List.of();
    private volatile int generation;
    private volatile PopulationPhase phase = PopulationPhase.INITIALIZED;
    private volatile boolean lastRoundDegraded;

    public Population(List<String> initialPrompts, Sampler sampler, EvolutionSettings settings,
                      CrossoverOperator crossover, MutationOperator mutation, Random random,
                      ExecutorService executor) {
        if (initialPrompts == null || initialPrompts.isEmpty()) {
            throw new ConfigurationException("Population needs at least one initial prompt");
        }
        for (String prompt : initialPrompts) {
            if (prompt == null || prompt.isBlank()) {
                throw new ConfigurationException("Initial prompts must not be blank");
            }
        }
        if (settings.eliteSize() > initialPrompts.size()) {
            throw new ConfigurationException("eliteSize " + settings.eliteSize()
                    + " exceeds population size " + initialPrompts.size());
        }
        this.sampler = sampler;
        this.settings = settings;
        this.crossover = crossover;
        this.mutation = mutation;
        this.random = random;
        this.sampleStage = new ParallelStage("sampler", executor, settings.sampleDeadline());
        this.genomes = IntStream.range(0, initialPrompts.size())
                .mapToObj(i -> Genome.initial(i, initialPrompts.get(i)))
                .toList();
    }

    /**
     * Asks the sampler for one action per genome, concurrently. Slots whose sampler throws,
     * returns nothing, or misses the deadline get a degraded no-op. The result is aligned
     * with {@link #genomes()}.
     */
    public synchronized List<Action> sample(Observation observation) {
        phase = PopulationPhase.SAMPLING;
        List<Genome> current = genomes;
        List<Action> actions = sampleStage.map(current,
                (index, genome) -> {
                    MdcContext.setGenome(genome.id());
                    Action action = sampler.sample(observation, genome);
                    return action != null ? action : Action.noop(genome.id(), true);
                },
                (index, genome, cause) -> Action.noop(genome.id(), true));

        lastRoundDegraded = actions.stream().anyMatch(Action::degraded);
        if (lastRoundDegraded) {
            log.warn("Generation {}: {} of {} genome(s) degraded to no-op actions", generation,
                    actions.stream().filter(Action::degraded).count(), actions.size());
        }
        return actions;
    }

    /**
     * Replaces the current generation by its offspring.
     *
     * @param rewards one reward per genome, aligned with {@link #genomes()}
     * @return the new generation
     * @throws ConfigurationException when the rewards do not match the population
     */
    public synchronized List<Genome> evolve(List<Double> rewards) {
        List<Genome> current = genomes;
        if (rewards == null || rewards.size() != current.size()) {
            throw new ConfigurationException("Expected " + current.size() + " rewards, got "
                    + (rewards == null ? "none" : rewards.size()));
        }
        for (Double reward : rewards) {
            if (reward == null || reward.isNaN()) {
                throw new ConfigurationException("Rewards must be numbers, got " + rewards);
            }
        }
        phase = PopulationPhase.EVALUATED;
        lastRewards = List.copyOf(rewards);

        int size = current.size();
        int nextGeneration = generation + 1;
        List<Integer> ranked = rank(rewards);
        double[] cumulative = cumulativeDistribution(rewards);

        var next = new ArrayList<Genome>(size);
        for (int k = 0; k < settings.eliteSize(); k++) {
            next.add(current.get(ranked.get(k)));
        }
        while (next.size() < size) {
            int first = select(cumulative);
            Genome parent = current.get(first);
            double parentReward = rewards.get(first);

            String prompt;
            List<String> parentIds;
            if (random.nextDouble() < settings.crossoverRate()) {
                int second = selectOther(cumulative, first);
                Genome other = current.get(second);
                prompt = crossover.crossover(parent, parentReward, other, rewards.get(second), random);
                parentIds = parent.id().equals(other.id()) ? List.of(parent.id()) : List.of(parent.id(), other.id());
            } else {
                prompt = parent.prompt();
                parentIds = List.of(parent.id());
            }
            if (random.nextDouble() < settings.mutationRate()) {
                prompt = mutation.mutate(prompt, parentReward, random);
            }
            next.add(new Genome(Genome.idFor(nextGeneration, next.size()), prompt, nextGeneration, parentIds));
        }

        genomes = List.copyOf(next);
        generation = nextGeneration;
        phase = PopulationPhase.EVOLVED;
        log.info("Evolved to generation {}; elites: {}", nextGeneration,
                next.subList(0, settings.eliteSize()).stream().map(Genome::id).collect(Collectors.joining(", ")));
        return genomes;
    }

    /** Indices ordered best-first; ties keep their original order. */
    List<Integer> rank(List<Double> rewards) {
        Comparator<Integer> byReward = Comparator.comparingDouble(rewards::get);
        if (settings.direction() == SelectionDirection.MAXIMIZE) {
            byReward = byReward.reversed();
        }
        var indices = new ArrayList<Integer>(IntStream.range(0, rewards.size()).boxed().toList());
        indices.sort(byReward);
        return indices;
    }

    /**
     * Cumulative selection probabilities. Each weight is the distance from the worst reward
     * plus one, so the worst genome keeps a non-zero chance.
     */
    double[] cumulativeDistribution(List<Double> rewards) {
        double worst = settings.direction() == SelectionDirection.MINIMIZE
                ? rewards.stream().mapToDouble(Double::doubleValue).max().orElse(0)
                : rewards.stream().mapToDouble(Double::doubleValue).min().orElse(0);
        double[] weights = new double[rewards.size()];
        double sum = 0.0;
        for (int i = 0; i < weights.length; i++) {
            weights[i] = Math.abs(worst - rewards.get(i)) + 1.0;
            sum += weights[i];
        }
        double[] cumulative = new double[weights.length];
        double s = 0.0;
        for (int i = 0; i < weights.length; i++) {
            s += weights[i] / sum;
            cumulative[i] = s;
        }
        cumulative[cumulative.length - 1] = 1.0;
        return cumulative;
    }

    private int select(double[] cumulative) {
        double r = random.nextDouble();
        for (int i = 0; i < cumulative.length; i++) {
            if (r < cumulative[i]) {
                return i;
            }
        }
        return cumulative.length - 1;
    }

    private int selectOther(double[] cumulative, int first) {
        int second = select(cumulative);
        for (int attempt = 0; attempt < 3 && second == first && cumulative.length > 1; attempt++) {
            second = select(cumulative);
        }
        return second;
    }

    public List<Genome> genomes() {
        return genomes;
    }

    public int size() {
        return genomes.size();
    }

    public int generation() {
        return generation;
    }

    public PopulationPhase phase() {
        return phase;
    }

    /** Rewards passed to the most recent {@link #evolve}, aligned with the previous generation. */
    public List<Double> lastRewards() {
        return lastRewards;
    }

    public boolean lastRoundDegraded() {
        return lastRoundDegraded;
    }

    public EvolutionSettings settings() {
        return settings;
    }
}
