package com.segym.core.llm;

/**
 * Thrown when the model returns null or blank content instead of a structured response.
 */
public class EmptyResponseException extends SchemaValidationException {

    public EmptyResponseException(String message) {
        super(message);
    }
}
