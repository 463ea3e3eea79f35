package com.segym.dispatch.cli;

import com.segym.core.engine.LoopProperties;
import com.segym.core.engine.RepairLoop;
import com.segym.core.events.EventBus;
import com.segym.core.events.SegymEvent;
import com.segym.core.evolution.Population;
import com.segym.core.model.IterationRecord;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: segym run [--iterations N] [--time-steps N]
 * <p>
 * Runs the repair loop and prints the rewards of each generation as they arrive,
 * followed by the best candidate found.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run the repair loop")
@Component
public class RunCommand implements Callable<Integer> {

    @Option(names = {"--iterations", "-i"}, description = "Number of resets (default: segym.loop.iterations)")
    private Integer iterations;

    @Option(names = {"--time-steps", "-t"}, description = "Generations per iteration (default: segym.loop.time-steps)")
    private Integer timeSteps;

    private final RepairLoop repairLoop;
    private final Population population;
    private final EventBus eventBus;
    private final LoopProperties loopProperties;

    public RunCommand(RepairLoop repairLoop, Population population, EventBus eventBus, LoopProperties loopProperties) {
        this.repairLoop = repairLoop;
        this.population = population;
        this.eventBus = eventBus;
        this.loopProperties = loopProperties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        int n = iterations != null ? iterations : loopProperties.getIterations();
        int t = timeSteps != null ? timeSteps : loopProperties.getTimeSteps();
        String runId = repairLoop.generateRunId();
        ConsoleOutput.info("Run " + runId + ": " + n + " iteration(s) x " + t + " time-step(s), "
                + population.size() + " genomes");

        var subscription = eventBus.subscribe(runId, this::print);
        List<IterationRecord> records;
        try {
            records = repairLoop.run(runId, n, t);
        } catch (Exception e) {
            ConsoleOutput.error("Run failed: " + rootCauseMessage(e));
            return 1;
        } finally {
            subscription.unsubscribe();
        }

        printBest(records);
        return 0;
    }

    private void print(SegymEvent event) {
        var payload = event.payload();
        switch (event.eventType()) {
            case "environment.reset" -> ConsoleOutput.sandbox("Baseline: " + payload.get("failing")
                    + " failing of " + payload.get("total") + " test(s)");
            case "generation.sampled" -> {
                if (Boolean.TRUE.equals(payload.get("degraded"))) {
                    ConsoleOutput.error("Some sampler calls degraded to no-op actions");
                }
            }
            case "generation.evaluated" -> {
                @SuppressWarnings("unchecked")
                var rewards = (List<Double>) payload.get("rewards");
                ConsoleOutput.generation(event.generation(), rewards,
                        (Double) payload.get("bestReward"), (String) payload.get("bestGenome"));
            }
            default -> { }
        }
    }

    private void printBest(List<IterationRecord> records) {
        var direction = population.settings().direction();
        IterationRecord best = null;
        int bestIndex = 0;
        for (IterationRecord r : records) {
            for (int i = 0; i < r.rewards().size(); i++) {
                if (best == null || direction.isBetter(r.rewards().get(i), best.rewards().get(bestIndex))) {
                    best = r;
                    bestIndex = i;
                }
            }
        }
        if (best == null) {
            return;
        }
        var action = best.actions().get(bestIndex);
        var state = best.states().get(bestIndex);
        System.out.println();
        ConsoleOutput.success("Best reward " + ConsoleOutput.formatReward(best.rewards().get(bestIndex))
                + " from genome " + best.genomes().get(bestIndex).id() + " (generation " + best.generation() + ")");
        System.out.println("Prompt: " + best.genomes().get(bestIndex).prompt());
        if (!action.noop()) {
            System.out.println("Edit: " + action.filename());
            System.out.println("--- old");
            System.out.println(action.oldCode());
            System.out.println("+++ new");
            System.out.println(action.newCode());
        }
        ConsoleOutput.testReport(state.report());
    }

    private static String rootCauseMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
