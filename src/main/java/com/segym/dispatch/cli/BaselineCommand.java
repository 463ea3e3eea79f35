package com.segym.dispatch.cli;

import com.segym.sandbox.Environment;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: segym baseline
 * <p>
 * Runs the test suite once on the unmodified project and prints the report.
 */
@Command(name = "baseline", mixinStandardHelpOptions = true, description = "Run the tests on the unmodified project")
@Component
public class BaselineCommand implements Callable<Integer> {

    private final Environment environment;

    public BaselineCommand(Environment environment) {
        this.environment = environment;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.sandbox("Running baseline tests...");
        try {
            var state = environment.reset();
            if (state.sandboxError()) {
                ConsoleOutput.error("Sandbox failed: " + state.errorMessage());
                return 2;
            }
            if (state.errorMessage() != null) {
                ConsoleOutput.error(state.errorMessage());
            }
            ConsoleOutput.testReport(state.report());
            return 0;
        } catch (Exception e) {
            ConsoleOutput.error("Baseline failed: " + e.getMessage());
            return 1;
        }
    }
}
