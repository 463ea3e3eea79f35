package com.segym.sandbox;

import com.segym.core.ConfigurationException;
import com.segym.core.dispatch.ParallelStage;
import com.segym.core.logging.MdcContext;
import com.segym.core.model.Action;
import com.segym.core.model.State;
import com.segym.core.model.TestReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * {@link Environment} backed by a {@link SandboxManager}. Candidates of one step run
 * concurrently, bounded by the executor, and share one deadline.
 * <p>
 * Candidate ids start with a token drawn per instance, so concurrent runs on one Docker
 * daemon never share container names.
 */
public class SandboxEnvironment implements Environment {

    private static final Logger log = LoggerFactory.getLogger(SandboxEnvironment.class);

    private static final String BASELINE_GENOME = "baseline";

    private final Path root;
    private final SandboxManager manager;
    private final ParallelStage stepStage;
    private final String instanceId = UUID.randomUUID().toString().substring(0, 8);

    private volatile long epoch;
    private volatile int baselineTotal;

    public SandboxEnvironment(Path projectRoot, SandboxManager manager, ExecutorService executor, Duration stepDeadline) {
        if (projectRoot == null || !Files.isDirectory(projectRoot)) {
            throw new ConfigurationException("Project tree not found: " + projectRoot);
        }
        this.root = projectRoot.toAbsolutePath().normalize();
        this.manager = manager;
        this.stepStage = new ParallelStage("sandbox", executor, stepDeadline);
    }

    @Override
    public synchronized State reset() {
        long current = ++epoch;
        log.info("Reset (epoch {}): running baseline tests in {}", current, root);
        try {
            var result = manager.execute(candidateId(current, "baseline"), root, Action.noop(BASELINE_GENOME, false), 0);
            baselineTotal = result.report().total();
            if (result.errorMessage() != null) {
                return new State(State.BASELINE_SLOT, current, root, Map.of(), null, result.report(), false, result.errorMessage());
            }
            return State.baseline(current, root, result.report());
        } catch (SandboxException e) {
            log.warn("Baseline run failed: {}", e.getMessage());
            return new State(State.BASELINE_SLOT, current, root, Map.of(), null,
                    TestReport.maximalFailure(baselineTotal, e.getMessage()), true, e.getMessage());
        }
    }

    @Override
    public List<State> step(List<Action> actions) {
        long current = epoch;
        if (current == 0) {
            throw new ConfigurationException("step called before reset");
        }
        return stepStage.map(actions,
                (slot, action) -> runSlot(current, slot, action),
                (slot, action, cause) -> {
                    String message = cause instanceof TimeoutException
                            ? "Step deadline exceeded" : String.valueOf(cause.getMessage());
                    return failure(current, slot, action, message, true);
                });
    }

    private State runSlot(long current, int slot, Action action) {
        MdcContext.setSlot(slot);
        MdcContext.setGenome(action.genomeId());
        String candidateId = candidateId(current, String.format("s%02d", slot));
        try {
            var result = manager.execute(candidateId, root, action, baselineTotal);
            return new State(slot, current, root, result.overlay(), action, result.report(), false, result.errorMessage());
        } catch (MalformedPatchException e) {
            log.info("Slot {}: patch rejected: {}", slot, e.getMessage());
            return failure(current, slot, action, e.getMessage(), false);
        } catch (SandboxException e) {
            log.warn("Slot {}: sandbox failed: {}", slot, e.getMessage());
            return failure(current, slot, action, e.getMessage(), true);
        }
    }

    String candidateId(long current, String suffix) {
        return instanceId + "-e" + current + "-" + suffix;
    }

    private State failure(long current, int slot, Action action, String message, boolean sandboxError) {
        return new State(slot, current, root, Map.of(), action,
                TestReport.maximalFailure(baselineTotal, message), sandboxError, message);
    }

    public Path root() {
        return root;
    }

    public long epoch() {
        return epoch;
    }
}
