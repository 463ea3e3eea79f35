package com.segym.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * {@link ModelClient} backed by Spring AI's {@link ChatClient}.
 * <p>
 * Uses {@link BeanOutputConverter} to generate a JSON schema from the requested output type
 * and appends its format instructions to the user prompt. The configured model name and
 * temperature are passed as per-call {@link ChatOptions}.
 */
@Service
public class ChatClientModelClient implements ModelClient {

    private static final Logger log = LoggerFactory.getLogger(ChatClientModelClient.class);

    private final ChatClient chatClient;
    private final ChatOptions options;

    public ChatClientModelClient(ChatClient.Builder builder, LlmProperties properties) {
        this.chatClient = builder.build();
        this.options = properties.hasModel() || properties.getTemperature() != null
                ? ChatOptions.builder()
                        .model(properties.hasModel() ? properties.getModel() : null)
                        .temperature(properties.getTemperature())
                        .build()
                : null;
        log.info("Model client initialized: model={}", properties.hasModel() ? properties.getModel() : "(provider default)");
    }

    @Override
    public String complete(ModelRequest<?> request) {
        String typeName = request.outputType().getSimpleName();
        var converter = new BeanOutputConverter<>(request.outputType());
        long start = System.currentTimeMillis();
        log.debug("LLM call started → {}", typeName);

        String response;
        try {
            var spec = chatClient.prompt()
                    .system(request.systemPrompt())
                    .user(request.userPrompt() + "\n\n" + converter.getFormat());
            if (options != null) {
                spec = spec.options(options);
            }
            response = spec.call().content();
        } catch (RuntimeException e) {
            throw translate(e, typeName);
        }

        long elapsed = System.currentTimeMillis() - start;
        log.debug("LLM call complete → {} ({}s)", typeName, String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new EmptyResponseException("LLM returned empty content for " + typeName);
        }
        return response;
    }

    static SamplerException translate(RuntimeException e, String typeName) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("429") || lower.contains("rate limit") || lower.contains("too many requests")) {
            return new RateLimitException("Rate limited while requesting " + typeName + ": " + message, e);
        }
        return new ModelTransportException("Model call for " + typeName + " failed: " + message, e);
    }
}
