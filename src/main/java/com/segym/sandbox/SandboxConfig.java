package com.segym.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class SandboxConfig {

    private static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    @Bean
    @ConditionalOnProperty(name = "segym.sandbox.provider", havingValue = "docker", matchIfMissing = true)
    public DockerClient dockerClient() {
        String dockerHost = System.getenv().getOrDefault("DOCKER_HOST", DEFAULT_UNIX_SOCKET);
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    @ConditionalOnProperty(name = "segym.sandbox.provider", havingValue = "docker", matchIfMissing = true)
    public SandboxProvider dockerSandboxProvider(DockerClient dockerClient) {
        return new DockerSandboxProvider(dockerClient);
    }

    @Bean
    @ConditionalOnProperty(name = "segym.sandbox.provider", havingValue = "process")
    public SandboxProvider processSandboxProvider() {
        return new ProcessSandboxProvider();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService sandboxExecutor(SandboxProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getMaxParallel()));
    }

    @Bean
    public Environment environment(SandboxProperties properties, SandboxManager sandboxManager,
                                   @Qualifier("sandboxExecutor") ExecutorService sandboxExecutor) {
        return new SandboxEnvironment(Path.of(properties.getProjectPath()), sandboxManager, sandboxExecutor,
                Duration.ofSeconds(properties.getStepDeadlineSeconds()));
    }
}
