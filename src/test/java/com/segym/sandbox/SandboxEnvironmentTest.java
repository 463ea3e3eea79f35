package com.segym.sandbox;

import com.segym.core.ConfigurationException;
import com.segym.core.fitness.FailedTestCount;
import com.segym.core.model.Action;
import com.segym.core.model.State;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class SandboxEnvironmentTest {

    @TempDir
    Path project;

    @TempDir
    Path workRoot;

    private FakeTestProvider provider;
    private SandboxProperties properties;
    private ExecutorService executor;
    private SandboxEnvironment environment;
    private final FailedTestCount fitness = new FailedTestCount();

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(project.resolve("calc.py"), "def add(a, b):\n    return a - b\n");
        provider = new FakeTestProvider();
        properties = new SandboxProperties();
        properties.getSandbox().setWorkRoot(workRoot.toString());
        executor = Executors.newFixedThreadPool(4);
        environment = new SandboxEnvironment(project, new SandboxManager(provider, properties, null),
                executor, Duration.ofSeconds(30));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("two consecutive resets report identical results")
    void resetIsRepeatable() {
        State first = environment.reset();
        State second = environment.reset();

        assertEquals(first.report().failingCount(), second.report().failingCount());
        assertEquals(first.report().testCases(), second.report().testCases());
        assertEquals(1, first.epoch());
        assertEquals(2, second.epoch());
        assertEquals(State.BASELINE_SLOT, second.slot());
        assertFalse(second.sandboxError());
    }

    @Test
    @DisplayName("step before reset is a configuration error")
    void stepBeforeReset() {
        assertThrows(ConfigurationException.class,
                () -> environment.step(List.of(Action.noop("G0-000", false))));
    }

    @Test
    @DisplayName("a missing project tree is rejected up front")
    void missingProjectTree() {
        assertThrows(ConfigurationException.class, () -> new SandboxEnvironment(project.resolve("nope"),
                new SandboxManager(provider, properties, null), executor, Duration.ofSeconds(1)));
    }

    @Test
    @DisplayName("step returns one state per action, in action order")
    void stepPreservesOrder() {
        environment.reset();
        var actions = List.of(
                Action.edit("G0-000", "calc.py", "return a - b", "return a + b"),
                Action.noop("G0-001", true),
                Action.edit("G0-002", "calc.py", "return a * b", "return a + b"),
                Action.edit("G0-003", "calc.py", "return a - b", "return b + a"));

        List<State> states = environment.step(actions);

        assertEquals(4, states.size());
        for (int i = 0; i < actions.size(); i++) {
            assertEquals(i, states.get(i).slot());
            assertSame(actions.get(i), states.get(i).action());
        }
        assertEquals(0.0, fitness.score(states.get(0)));
        assertEquals(1.0, fitness.score(states.get(1)));
        assertTrue(states.get(2).isMaximalFailure());
        assertFalse(states.get(2).sandboxError());
        assertEquals(2.0, fitness.score(states.get(2)));
        assertEquals(1.0, fitness.score(states.get(3)));
    }

    @Test
    @DisplayName("a no-op action reports the same failing count as the baseline")
    void noopMatchesBaseline() {
        State baseline = environment.reset();

        State state = environment.step(List.of(Action.noop("G0-000", true))).get(0);

        assertEquals(fitness.score(baseline), fitness.score(state));
        assertTrue(state.overlay().isEmpty());
    }

    @Test
    @DisplayName("a sandbox timeout yields a sandbox-error state with maximal reward")
    void timeoutIsMaximalFailure() {
        State baseline = environment.reset();
        provider.timeOut = true;

        State state = environment.step(List.of(Action.edit("G0-000", "calc.py", "return a - b", "return a + b"))).get(0);

        assertTrue(state.sandboxError());
        assertTrue(state.isMaximalFailure());
        assertTrue(fitness.score(state) >= baseline.report().total());
        assertTrue(fitness.score(state) > fitness.score(baseline));
    }

    @Test
    @DisplayName("sandbox start failures are contained in the state")
    void startFailureIsContained() {
        environment.reset();
        provider.failToStart = true;

        State state = environment.step(List.of(Action.noop("G0-000", false))).get(0);

        assertTrue(state.sandboxError());
        assertEquals("daemon unreachable", state.errorMessage());
    }

    @Test
    @DisplayName("candidates still running at the step deadline are cancelled")
    void stepDeadlineCancelsSlowCandidates() {
        var slow = new FakeTestProvider() {
            @Override
            public int waitForCompletion(String sandboxId, int timeoutSeconds) {
                if (sandboxId.endsWith("baseline")) {
                    return super.waitForCompletion(sandboxId, timeoutSeconds);
                }
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return -1;
            }
        };
        var env = new SandboxEnvironment(project, new SandboxManager(slow, properties, null),
                executor, Duration.ofMillis(300));
        env.reset();

        long start = System.nanoTime();
        State state = env.step(List.of(Action.noop("G0-000", false))).get(0);

        assertTrue(Duration.ofNanos(System.nanoTime() - start).toSeconds() < 5);
        assertTrue(state.sandboxError());
        assertEquals("Step deadline exceeded", state.errorMessage());
    }

    @Test
    @DisplayName("two environments on one provider never reuse a sandbox name")
    void distinctSandboxNamesAcrossEnvironments() {
        var other = new SandboxEnvironment(project, new SandboxManager(provider, properties, null),
                executor, Duration.ofSeconds(30));

        environment.reset();
        other.reset();
        environment.step(List.of(Action.noop("G0-000", false)));
        other.step(List.of(Action.noop("G0-000", false)));

        assertEquals(4, provider.tornDown.size());
        assertEquals(4, provider.tornDown.stream().map(DockerSandboxProvider::containerName).distinct().count());
        assertTrue(provider.tornDown.get(0).endsWith("-e1-baseline"));
        assertTrue(provider.tornDown.get(2).endsWith("-e1-s00"));
    }

    @Test
    @DisplayName("an empty action list yields no states")
    void emptyStep() {
        environment.reset();

        assertTrue(environment.step(List.of()).isEmpty());
    }
}
