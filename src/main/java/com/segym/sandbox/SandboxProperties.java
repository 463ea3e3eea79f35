package com.segym.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "segym")
public class SandboxProperties {

    private Sandbox sandbox = new Sandbox();

    // -- Sandbox accessors (delegate to nested) --
    public String getProvider() { return sandbox.provider; }
    public String getProjectPath() { return sandbox.projectPath; }
    public String getTestCommand() { return sandbox.testCommand; }
    public String getReportFile() { return sandbox.reportFile; }
    public String getImage() { return sandbox.image; }
    public int getTimeoutSeconds() { return sandbox.timeoutSeconds; }
    public int getStepDeadlineSeconds() { return sandbox.stepDeadlineSeconds; }
    public int getMaxParallel() { return sandbox.maxParallel; }
    public int getMemoryLimitMb() { return sandbox.memoryLimitMb; }
    public int getCpuCount() { return sandbox.cpuCount; }
    public String getWorkRoot() { return sandbox.workRoot; }
    public Map<String, String> getEnv() { return sandbox.env; }

    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }

    public static class Sandbox {
        /** "docker" or "process". */
        private String provider = "docker";
        private String projectPath = ".";
        private String testCommand = "pytest --junitxml=testresults.xml";
        /** Report written by the test command, relative to the project root. Blank disables XML parsing. */
        private String reportFile = "testresults.xml";
        private String image = "python:3.11-slim";
        private int timeoutSeconds = 300;
        private int stepDeadlineSeconds = 900;
        private int maxParallel = 4;
        private int memoryLimitMb = 2048;
        private int cpuCount = 1;
        /** Parent of the per-candidate working copies; system temp dir when blank. */
        private String workRoot = "";
        private Map<String, String> env = new HashMap<>();

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getProjectPath() { return projectPath; }
        public void setProjectPath(String projectPath) { this.projectPath = projectPath; }
        public String getTestCommand() { return testCommand; }
        public void setTestCommand(String testCommand) { this.testCommand = testCommand; }
        public String getReportFile() { return reportFile; }
        public void setReportFile(String reportFile) { this.reportFile = reportFile; }
        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public int getStepDeadlineSeconds() { return stepDeadlineSeconds; }
        public void setStepDeadlineSeconds(int stepDeadlineSeconds) { this.stepDeadlineSeconds = stepDeadlineSeconds; }
        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public int getMemoryLimitMb() { return memoryLimitMb; }
        public void setMemoryLimitMb(int memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
        public int getCpuCount() { return cpuCount; }
        public void setCpuCount(int cpuCount) { this.cpuCount = cpuCount; }
        public String getWorkRoot() { return workRoot; }
        public void setWorkRoot(String workRoot) { this.workRoot = workRoot; }
        public Map<String, String> getEnv() { return env; }
        public void setEnv(Map<String, String> env) { this.env = env; }
    }
}
