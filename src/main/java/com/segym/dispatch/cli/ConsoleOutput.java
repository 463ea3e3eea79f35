package com.segym.dispatch.cli;

import com.segym.core.model.TestOutcome;
import com.segym.core.model.TestReport;
import picocli.CommandLine;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for the SE-Gym CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SE-GYM v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SEGYM]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void sandbox(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(magenta) [SANDBOX]|@ " + message));
    }

    public static void generation(int generation, List<Double> rewards, double best, String bestGenome) {
        String formatted = rewards.stream().map(ConsoleOutput::formatReward).collect(Collectors.joining(" "));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [GEN " + generation + "]|@ rewards " + formatted
                        + " | best @|bold " + formatReward(best) + "|@ (" + bestGenome + ")"));
    }

    public static void testReport(TestReport report) {
        String status = report.failingCount() == 0 ? "@|fg(green) PASS|@" : "@|fg(red) FAIL|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) [TEST]|@ " + status + " " + report.total() + " tests: "
                        + report.passed() + " passed, " + report.failed() + " failed, "
                        + report.errors() + " errors, " + report.skipped() + " skipped"
                        + " (exit " + report.exitCode() + ")"));
        for (var testCase : report.testCases()) {
            if (testCase.outcome() == TestOutcome.FAILED
                    || testCase.outcome() == TestOutcome.ERROR) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "    @|fg(red) -|@ " + testCase.name()));
            }
        }
    }

    static String formatReward(double reward) {
        return reward == Math.rint(reward) ? String.valueOf((long) reward) : String.format("%.3f", reward);
    }
}
