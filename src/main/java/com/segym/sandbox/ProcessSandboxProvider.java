package com.segym.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the test command as a local child process in the candidate's working copy.
 *
 * <p>No memory or CPU isolation: meant for development and for hosts without Docker.
 * Output goes to a log file next to the process rather than a pipe, so a chatty test
 * suite cannot block on a full buffer.
 */
public class ProcessSandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(ProcessSandboxProvider.class);

    private record Running(Process process, Path logFile) {}

    private final Map<String, Running> running = new ConcurrentHashMap<>();
    private final AtomicLong counter = new AtomicLong();

    @Override
    public String openSandbox(SandboxRequest request) {
        String sandboxId = request.candidateId() + "-p" + counter.incrementAndGet();
        try {
            Path logFile = Files.createTempFile("segym-" + request.candidateId() + "-", ".log");
            var builder = new ProcessBuilder("sh", "-c", request.command())
                    .directory(request.workDir().toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(logFile.toFile());
            builder.environment().putAll(request.env());
            Process process = builder.start();
            running.put(sandboxId, new Running(process, logFile));
            log.debug("Sandbox {} started (pid {}) in {}", sandboxId, process.pid(), request.workDir());
            return sandboxId;
        } catch (IOException e) {
            throw new SandboxException("Failed to start test command for " + request.candidateId(), e);
        }
    }

    @Override
    public int waitForCompletion(String sandboxId, int timeoutSeconds) {
        Running r = require(sandboxId);
        try {
            if (!r.process().waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Sandbox {} exceeded {}s, killing", sandboxId, timeoutSeconds);
                kill(r.process());
                return -1;
            }
            return r.process().exitValue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill(r.process());
            return -1;
        }
    }

    @Override
    public String captureOutput(String sandboxId) {
        Running r = require(sandboxId);
        try {
            return Files.readString(r.logFile(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read output of sandbox {}: {}", sandboxId, e.getMessage());
            return "";
        }
    }

    @Override
    public void teardownSandbox(String sandboxId) {
        Running r = running.remove(sandboxId);
        if (r == null) {
            return;
        }
        kill(r.process());
        try {
            Files.deleteIfExists(r.logFile());
        } catch (IOException e) {
            log.debug("Could not delete log file {}: {}", r.logFile(), e.getMessage());
        }
    }

    /**
     * Kills the shell and everything it spawned. Descendants go first: once the shell is
     * gone its children are reparented and no longer reachable from its handle.
     */
    static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private Running require(String sandboxId) {
        Running r = running.get(sandboxId);
        if (r == null) {
            throw new SandboxException("Unknown sandbox " + sandboxId);
        }
        return r;
    }
}
