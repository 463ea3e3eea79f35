package com.segym.core.llm;

/**
 * Thrown when model output cannot be parsed into, or validated against, the expected schema.
 */
public class SchemaValidationException extends SamplerException {

    public SchemaValidationException(String message) {
        super(message);
    }

    public SchemaValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
