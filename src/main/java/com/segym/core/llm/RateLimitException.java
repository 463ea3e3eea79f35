package com.segym.core.llm;

/**
 * Thrown when the model provider rejects a call because of rate limiting (HTTP 429).
 */
public class RateLimitException extends SamplerException {

    public RateLimitException(String message, Throwable cause) {
        super(message, cause);
    }
}
