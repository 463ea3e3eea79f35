package com.segym.core.llm;

/**
 * Base class for failures of a single model call. All subclasses are transient from the
 * loop's point of view: callers retry them and eventually degrade to a fallback value.
 */
public class SamplerException extends RuntimeException {

    public SamplerException(String message) {
        super(message);
    }

    public SamplerException(String message, Throwable cause) {
        super(message, cause);
    }
}
