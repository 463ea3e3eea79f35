package com.segym.sandbox;

/**
 * Abstraction over where the test command runs.
 * Implementations: {@link DockerSandboxProvider} (default), {@link ProcessSandboxProvider} (local).
 */
public interface SandboxProvider {

    /**
     * Starts the test command for a candidate.
     * @return the sandbox id
     */
    String openSandbox(SandboxRequest request);

    /**
     * Blocks until the sandbox exits or the timeout is reached.
     * @return the exit code, or -1 on timeout
     */
    int waitForCompletion(String sandboxId, int timeoutSeconds);

    /**
     * Captures stdout/stderr of the sandbox.
     */
    String captureOutput(String sandboxId);

    /**
     * Stops the sandbox and releases its resources. Safe to call more than once.
     */
    void teardownSandbox(String sandboxId);
}
