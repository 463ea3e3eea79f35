package com.segym.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.WaitContainerResultCallback;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Volume;
import com.github.dockerjava.core.command.LogContainerResultCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Docker-based SandboxProvider.
 *
 * <p>Each candidate gets its own container:
 * <ul>
 *   <li>the candidate's copy of the tree bind-mounted at {@code /repo}</li>
 *   <li>memory and CPU limits from the request</li>
 *   <li>networking disabled</li>
 *   <li>command: {@code sh -c <test command>} in {@code /repo}</li>
 * </ul>
 */
public class DockerSandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(DockerSandboxProvider.class);

    static final String MOUNT_POINT = "/repo";

    private final DockerClient dockerClient;

    public DockerSandboxProvider(DockerClient dockerClient) {
        this.dockerClient = dockerClient;
    }

    @Override
    public String openSandbox(SandboxRequest request) {
        String containerName = containerName(request.candidateId());
        log.info("Opening sandbox {} (image: {})", containerName, request.image());

        // A previous run may have left a container with the same name behind
        try {
            dockerClient.removeContainerCmd(containerName).withForce(true).exec();
            log.debug("Removed stale container {}", containerName);
        } catch (Exception e) {
            log.trace("No stale container {}: {}", containerName, e.getMessage());
        }

        var envList = new ArrayList<String>();
        request.env().forEach((k, v) -> envList.add(k + "=" + v));

        var hostConfig = HostConfig.newHostConfig()
                .withBinds(new Bind(request.workDir().toAbsolutePath().toString(), new Volume(MOUNT_POINT), AccessMode.rw))
                .withMemory((long) request.memoryLimitMb() * 1024 * 1024)
                .withCpuCount((long) request.cpuCount())
                .withNetworkMode("none");

        try {
            var response = dockerClient.createContainerCmd(request.image())
                    .withName(containerName)
                    .withHostConfig(hostConfig)
                    .withEnv(envList)
                    .withCmd("sh", "-c", request.command())
                    .withWorkingDir(MOUNT_POINT)
                    .exec();

            String containerId = response.getId();
            dockerClient.startContainerCmd(containerId).exec();
            log.debug("Sandbox {} started (container {})", containerName, containerId);
            return containerId;
        } catch (RuntimeException e) {
            throw new SandboxException("Failed to start sandbox " + containerName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public int waitForCompletion(String sandboxId, int timeoutSeconds) {
        try {
            var callback = dockerClient.waitContainerCmd(sandboxId)
                    .exec(new WaitContainerResultCallback());
            var result = callback.awaitStatusCode(timeoutSeconds, TimeUnit.SECONDS);
            return result != null ? result : -1;
        } catch (Exception e) {
            log.warn("Timeout or error waiting for sandbox {}: {}", sandboxId, e.getMessage());
            return -1;
        }
    }

    @Override
    public String captureOutput(String sandboxId) {
        var sb = new StringBuilder();
        try {
            dockerClient.logContainerCmd(sandboxId)
                    .withStdOut(true)
                    .withStdErr(true)
                    .withFollowStream(false)
                    .exec(new LogContainerResultCallback() {
                        @Override
                        public void onNext(Frame frame) {
                            sb.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                        }
                    }).awaitCompletion(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while capturing output from sandbox {}", sandboxId);
        }
        return sb.toString();
    }

    @Override
    public void teardownSandbox(String sandboxId) {
        try {
            dockerClient.stopContainerCmd(sandboxId).exec();
        } catch (Exception e) {
            log.debug("Container {} may already be stopped: {}", sandboxId, e.getMessage());
        }
        try {
            dockerClient.removeContainerCmd(sandboxId).withForce(true).exec();
            log.debug("Sandbox {} torn down", sandboxId);
        } catch (Exception e) {
            log.warn("Failed to remove container {}", sandboxId, e);
        }
    }

    static String containerName(String candidateId) {
        return "segym-" + candidateId.toLowerCase().replaceAll("[^a-z0-9_.-]", "-");
    }
}
