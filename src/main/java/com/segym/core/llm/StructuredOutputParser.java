package com.segym.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.converter.BeanOutputConverter;

/**
 * Converts raw model output into a typed record.
 * <p>
 * Tries Spring AI's {@link BeanOutputConverter} first, then falls back to a lenient Jackson
 * mapper after stripping markdown code fences, which many models wrap JSON in.
 */
public final class StructuredOutputParser {

    private static final Logger log = LoggerFactory.getLogger(StructuredOutputParser.class);

    private static final ObjectMapper LENIENT = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
            .registerModule(new ParameterNamesModule());

    private StructuredOutputParser() {}

    /**
     * @throws SchemaValidationException when neither strategy yields an instance
     */
    public static <T> T parse(String raw, Class<T> outputType) {
        if (raw == null || raw.isBlank()) {
            throw new EmptyResponseException("Empty response for " + outputType.getSimpleName());
        }
        try {
            T converted = new BeanOutputConverter<>(outputType).convert(raw);
            if (converted != null) {
                return converted;
            }
        } catch (RuntimeException e) {
            log.debug("Strict conversion to {} failed: {}", outputType.getSimpleName(), e.getMessage());
        }
        return parseWithJackson(raw, outputType);
    }

    private static <T> T parseWithJackson(String json, Class<T> outputType) {
        String cleaned = stripFences(json);
        try {
            T result = LENIENT.readValue(cleaned, outputType);
            if (result == null) {
                throw new SchemaValidationException("Response for " + outputType.getSimpleName() + " was JSON null");
            }
            return result;
        } catch (SchemaValidationException e) {
            throw e;
        } catch (Exception e) {
            log.debug("Raw LLM response: {}", json);
            throw new SchemaValidationException("Failed to parse LLM response to "
                    + outputType.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    static String stripFences(String json) {
        String cleaned = json.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
