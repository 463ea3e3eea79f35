package com.segym.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Model selection for every call the loop makes. Threaded into {@link ChatClientModelClient}
 * at construction time.
 */
@Component
@ConfigurationProperties(prefix = "segym.llm")
public class LlmProperties {

    private String model = "";
    private Double temperature;

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public Double getTemperature() {
        return temperature;
    }

    public void setTemperature(Double temperature) {
        this.temperature = temperature;
    }

    public boolean hasModel() {
        return model != null && !model.isBlank();
    }
}
