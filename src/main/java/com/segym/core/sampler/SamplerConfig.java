package com.segym.core.sampler;

import com.segym.core.llm.ModelClient;
import com.segym.core.metrics.SegymMetrics;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SamplerConfig {

    @Bean
    public Sampler sampler(ModelClient modelClient, SamplerProperties properties,
                           @Autowired(required = false) SegymMetrics metrics) {
        return new LlmSampler(modelClient, properties.toRetryPolicy(), Sleeper.SYSTEM, metrics);
    }
}
