package com.segym.core.llm;

/**
 * Thrown when the model endpoint could not be reached or answered with a server error.
 */
public class ModelTransportException extends SamplerException {

    public ModelTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
