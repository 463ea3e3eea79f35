package com.segym.core.engine;

import com.segym.core.ConfigurationException;
import com.segym.core.events.EventBus;
import com.segym.core.events.SegymEvent;
import com.segym.core.evolution.Population;
import com.segym.core.evolution.SelectionDirection;
import com.segym.core.fitness.FitnessFunction;
import com.segym.core.logging.MdcContext;
import com.segym.core.metrics.SegymMetrics;
import com.segym.core.model.Action;
import com.segym.core.model.Genome;
import com.segym.core.model.IterationRecord;
import com.segym.core.model.Observation;
import com.segym.core.model.State;
import com.segym.core.observer.Observer;
import com.segym.sandbox.Environment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives the repair loop: reset -> observe -> sample -> step -> score -> evolve.
 * <p>
 * Each iteration starts from a fresh reset. Within an iteration every time-step observes
 * the reset state, because every candidate edit is applied to the unmodified tree.
 * One {@link IterationRecord} is returned per time-step.
 */
@Service
public class RepairLoop {

    private static final Logger log = LoggerFactory.getLogger(RepairLoop.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final Environment environment;
    private final Observer observer;
    private final Population population;
    private final FitnessFunction fitness;
    private final EventBus eventBus;
    private final SegymMetrics metrics;

    public RepairLoop(Environment environment, Observer observer, Population population,
                      FitnessFunction fitness, EventBus eventBus,
                      @Autowired(required = false) SegymMetrics metrics) {
        if (fitness.direction() != population.settings().direction()) {
            throw new ConfigurationException("Fitness " + fitness.getClass().getSimpleName() + " is "
                    + fitness.direction() + " but selection is configured to " + population.settings().direction());
        }
        this.environment = environment;
        this.observer = observer;
        this.population = population;
        this.fitness = fitness;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public List<IterationRecord> run(int iterations, int timeSteps) {
        return run(generateRunId(), iterations, timeSteps);
    }

    /**
     * @param runId      id used for events and log context
     * @param iterations number of resets
     * @param timeSteps  generations per iteration
     * @return one record per time-step, in execution order
     * @throws ConfigurationException when either count is not positive
     */
    public List<IterationRecord> run(String runId, int iterations, int timeSteps) {
        if (iterations < 1 || timeSteps < 1) {
            throw new ConfigurationException("iterations and timeSteps must be positive, got "
                    + iterations + " and " + timeSteps);
        }
        MdcContext.setRun(runId);
        try {
            log.info("Starting run {}: {} iteration(s) x {} time-step(s), population {}",
                    runId, iterations, timeSteps, population.size());
            publish("loop.started", runId, -1, Map.of(
                    "iterations", iterations, "timeSteps", timeSteps, "populationSize", population.size()));

            var records = new ArrayList<IterationRecord>(iterations * timeSteps);
            for (int iteration = 0; iteration < iterations; iteration++) {
                State baseline = environment.reset();
                log.info("Iteration {}: baseline has {} failing of {} test(s)", iteration,
                        baseline.report().failingCount(), baseline.report().total());
                publish("environment.reset", runId, population.generation(), Map.of(
                        "iteration", iteration,
                        "failing", baseline.report().failingCount(),
                        "total", baseline.report().total(),
                        "sandboxError", baseline.sandboxError()));

                for (int t = 0; t < timeSteps; t++) {
                    records.add(timeStep(runId, iteration, t, baseline));
                }
            }

            IterationRecord best = bestRecord(records, population.settings().direction());
            int bestIndex = bestIndex(best.rewards(), population.settings().direction());
            log.info("Run {} completed: best reward {} from genome {} (generation {})", runId,
                    best.rewards().get(bestIndex), best.genomes().get(bestIndex).id(), best.generation());
            publish("loop.completed", runId, population.generation(), Map.of(
                    "records", records.size(),
                    "bestReward", best.rewards().get(bestIndex),
                    "bestGenome", best.genomes().get(bestIndex).id()));
            return records;
        } finally {
            MdcContext.clear();
        }
    }

    private IterationRecord timeStep(String runId, int iteration, int t, State baseline) {
        int generation = population.generation();
        MdcContext.setGeneration(runId, generation);
        List<Genome> genomes = population.genomes();

        Observation observation = observer.observe(baseline);
        List<Action> actions = population.sample(observation);
        boolean degraded = population.lastRoundDegraded();
        publish("generation.sampled", runId, generation, Map.of(
                "actions", actions.size(),
                "noops", actions.stream().filter(Action::noop).count(),
                "degraded", degraded));

        List<State> states = environment.step(actions);
        var rewards = new ArrayList<Double>(states.size());
        for (State state : states) {
            rewards.add(fitness.score(state));
        }
        int bestIndex = bestIndex(rewards, population.settings().direction());
        log.info("Generation {} rewards: {} (best {} from {})", generation, rewards,
                rewards.get(bestIndex), genomes.get(bestIndex).id());
        if (metrics != null) {
            metrics.recordGeneration(rewards.get(bestIndex));
        }
        publish("generation.evaluated", runId, generation, Map.of(
                "rewards", List.copyOf(rewards),
                "bestReward", rewards.get(bestIndex),
                "bestGenome", genomes.get(bestIndex).id(),
                "sandboxErrors", states.stream().filter(State::sandboxError).count()));

        var record = new IterationRecord(iteration, t, generation, genomes, actions, states, rewards, degraded);

        List<Genome> next = population.evolve(rewards);
        publish("generation.evolved", runId, population.generation(), Map.of(
                "genomes", next.stream().map(Genome::id).toList()));
        return record;
    }

    /** Index of the best reward; ties go to the earlier index. */
    static int bestIndex(List<Double> rewards, SelectionDirection direction) {
        int best = 0;
        for (int i = 1; i < rewards.size(); i++) {
            if (direction.isBetter(rewards.get(i), rewards.get(best))) {
                best = i;
            }
        }
        return best;
    }

    static IterationRecord bestRecord(List<IterationRecord> records, SelectionDirection direction) {
        IterationRecord best = records.get(0);
        for (IterationRecord r : records) {
            double candidate = r.rewards().get(bestIndex(r.rewards(), direction));
            double current = best.rewards().get(bestIndex(best.rewards(), direction));
            if (direction.isBetter(candidate, current)) {
                best = r;
            }
        }
        return best;
    }

    private void publish(String type, String runId, int generation, Map<String, Object> payload) {
        eventBus.publish(new SegymEvent(type, runId, generation, payload, Instant.now()));
    }

    /**
     * Generates a unique run ID in the format SEGYM-YYYY-NNNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("SEGYM-%d-%04d", year, count);
    }
}
