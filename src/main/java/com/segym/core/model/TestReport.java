package com.segym.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of running the project's test command once.
 *
 * @param exitCode  exit code of the test command, -1 if it never completed
 * @param passed    number of passing tests
 * @param failed    number of failing tests
 * @param errors    number of tests that errored
 * @param skipped   number of skipped tests
 * @param testCases per-test results when a structured report was available
 * @param output    captured stdout/stderr
 */
public record TestReport(
    int exitCode,
    int passed,
    int failed,
    int errors,
    int skipped,
    List<TestCaseResult> testCases,
    String output
) implements Serializable {

    public TestReport {
        testCases = testCases != null ? List.copyOf(testCases) : List.of();
        output = output != null ? output : "";
    }

    /** Failed plus errored tests. */
    public int failingCount() {
        return failed + errors;
    }

    public int total() {
        return passed + failed + errors + skipped;
    }

    /**
     * A report in which every test counts as failed. Used for sandbox crashes,
     * timeouts and patches that could not be applied. At least one test is
     * reported as failing so the penalty never ties with a clean run.
     */
    public static TestReport maximalFailure(int totalTests, String reason) {
        return new TestReport(-1, 0, Math.max(1, totalTests), 0, 0, List.of(), reason);
    }

    public static TestReport fromCases(int exitCode, List<TestCaseResult> cases, String output) {
        int passed = 0, failed = 0, errors = 0, skipped = 0;
        for (var c : cases) {
            switch (c.outcome()) {
                case PASSED -> passed++;
                case FAILED -> failed++;
                case ERROR -> errors++;
                case SKIPPED -> skipped++;
            }
        }
        return new TestReport(exitCode, passed, failed, errors, skipped, cases, output);
    }
}
