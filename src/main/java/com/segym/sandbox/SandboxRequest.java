package com.segym.sandbox;

import java.nio.file.Path;
import java.util.Map;

/**
 * Everything a {@link SandboxProvider} needs to run the test command for one candidate.
 *
 * @param candidateId   unique id for naming the sandbox, e.g. "e3-s02"
 * @param workDir       host directory holding the candidate's copy of the tree
 * @param image         container image (ignored by the process provider)
 * @param command       shell command that runs the tests
 * @param memoryLimitMb memory cap for the sandbox
 * @param cpuCount      CPU cap for the sandbox
 * @param env           extra environment variables
 */
public record SandboxRequest(
    String candidateId,
    Path workDir,
    String image,
    String command,
    int memoryLimitMb,
    int cpuCount,
    Map<String, String> env
) {

    public SandboxRequest {
        env = env != null ? Map.copyOf(env) : Map.of();
    }
}
