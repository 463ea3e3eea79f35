package com.segym.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "segym.loop")
public class LoopProperties {

    private int iterations = 1;
    private int timeSteps = 5;

    public int getIterations() { return iterations; }
    public void setIterations(int iterations) { this.iterations = iterations; }
    public int getTimeSteps() { return timeSteps; }
    public void setTimeSteps(int timeSteps) { this.timeSteps = timeSteps; }
}
