package com.segym.sandbox;

import com.segym.core.metrics.SegymMetrics;
import com.segym.core.model.Action;
import com.segym.core.model.TestReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Runs the test suite for one candidate inside a sandbox.
 *
 * <p>Flow: copy canonical tree -> apply edit -> open sandbox -> wait -> capture output ->
 * parse report -> teardown -> delete copy. The canonical tree is never written to.
 */
@Service
public class SandboxManager {

    private static final Logger log = LoggerFactory.getLogger(SandboxManager.class);

    private final SandboxProvider provider;
    private final SandboxProperties properties;
    private final PatchApplier patchApplier;
    private final TestReportParser reportParser;
    private final SegymMetrics metrics;

    public SandboxManager(SandboxProvider provider, SandboxProperties properties,
                          @Autowired(required = false) SegymMetrics metrics) {
        this(provider, properties, new PatchApplier(), new TestReportParser(), metrics);
    }

    SandboxManager(SandboxProvider provider, SandboxProperties properties, PatchApplier patchApplier,
                   TestReportParser reportParser, SegymMetrics metrics) {
        this.provider = provider;
        this.properties = properties;
        this.patchApplier = patchApplier;
        this.reportParser = reportParser;
        this.metrics = metrics;
    }

    /**
     * Result of running one candidate.
     *
     * @param exitCode     exit code of the test command
     * @param output       captured stdout/stderr
     * @param sandboxId    the sandbox that ran this candidate
     * @param report       parsed test report
     * @param overlay      files the edit wrote, keyed by relative path
     * @param errorMessage set when {@code report} is a maximal failure: no report could be produced,
     *                     or the run lost tests the baseline had
     * @param elapsedMs    wall-clock time in milliseconds
     */
    public record ExecutionResult(
        int exitCode,
        String output,
        String sandboxId,
        TestReport report,
        Map<String, String> overlay,
        String errorMessage,
        long elapsedMs
    ) {}

    /**
     * @param candidateId   name for the sandbox and its working copy
     * @param canonicalRoot read-only project tree
     * @param action        edit to apply first; no-op actions run the tree unchanged
     * @param baselineTotal test count used to size a maximal-failure report; a parsed report with
     *                      fewer tests than this counts as a maximal failure
     * @throws MalformedPatchException when the edit cannot be applied
     * @throws SandboxException        when the sandbox fails to start or times out
     */
    public ExecutionResult execute(String candidateId, Path canonicalRoot, Action action, int baselineTotal) {
        long startMs = System.currentTimeMillis();
        Path workDir = createWorkDir(candidateId);
        try {
            WorkspaceCopier.copyTree(canonicalRoot, workDir);
            Map<String, String> overlay;
            try {
                overlay = patchApplier.apply(workDir, action);
            } catch (MalformedPatchException e) {
                record("malformed", startMs);
                throw e;
            }
            Path reportFile = reportFile(workDir);
            if (reportFile != null) {
                Files.deleteIfExists(reportFile);
            }

            var request = new SandboxRequest(candidateId, workDir, properties.getImage(), properties.getTestCommand(),
                    properties.getMemoryLimitMb(), properties.getCpuCount(), properties.getEnv());
            String sandboxId = provider.openSandbox(request);
            try {
                int exitCode = provider.waitForCompletion(sandboxId, properties.getTimeoutSeconds());
                if (exitCode == -1) {
                    record("timeout", startMs);
                    throw new SandboxTimeoutException("Sandbox " + candidateId + " did not finish within "
                            + properties.getTimeoutSeconds() + "s");
                }
                String output = provider.captureOutput(sandboxId);
                long elapsedMs = System.currentTimeMillis() - startMs;

                var parsed = reportParser.parse(reportFile, exitCode, output);
                TestReport report;
                String errorMessage = null;
                if (parsed.isPresent() && parsed.get().total() < baselineTotal) {
                    errorMessage = "Ran " + parsed.get().total() + " of " + baselineTotal + " baseline tests";
                    report = TestReport.maximalFailure(baselineTotal, output);
                } else if (parsed.isPresent()) {
                    report = parsed.get();
                } else if (exitCode == 0) {
                    report = new TestReport(0, 0, 0, 0, 0, null, output);
                } else {
                    errorMessage = "No test report and exit code " + exitCode;
                    report = TestReport.maximalFailure(baselineTotal, output);
                }
                record(report.failingCount() == 0 && errorMessage == null ? "passed" : "failed", startMs);
                log.info("Sandbox {} finished with exit code {} in {}ms: {} passed, {} failing",
                        candidateId, exitCode, elapsedMs, report.passed(), report.failingCount());
                return new ExecutionResult(exitCode, output, sandboxId, report, overlay, errorMessage, elapsedMs);
            } finally {
                provider.teardownSandbox(sandboxId);
            }
        } catch (IOException e) {
            record("error", startMs);
            throw new SandboxException("Could not prepare working copy for " + candidateId + ": " + e.getMessage(), e);
        } catch (SandboxException e) {
            if (!(e instanceof SandboxTimeoutException)) {
                record("error", startMs);
            }
            throw e;
        } finally {
            try {
                WorkspaceCopier.deleteTree(workDir);
            } catch (IOException e) {
                log.warn("Could not delete working copy {}: {}", workDir, e.getMessage());
            }
        }
    }

    private Path createWorkDir(String candidateId) {
        try {
            String prefix = "segym-" + candidateId + "-";
            String workRoot = properties.getWorkRoot();
            if (workRoot == null || workRoot.isBlank()) {
                return Files.createTempDirectory(prefix);
            }
            Path parent = Files.createDirectories(Path.of(workRoot));
            return Files.createTempDirectory(parent, prefix);
        } catch (IOException e) {
            throw new SandboxException("Could not create working copy for " + candidateId, e);
        }
    }

    private Path reportFile(Path workDir) {
        String reportFile = properties.getReportFile();
        return reportFile == null || reportFile.isBlank() ? null : workDir.resolve(reportFile);
    }

    private void record(String outcome, long startMs) {
        if (metrics != null) {
            metrics.recordSandboxRun(outcome, System.currentTimeMillis() - startMs);
        }
    }
}
