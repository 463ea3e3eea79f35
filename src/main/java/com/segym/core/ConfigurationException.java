package com.segym.core;

/**
 * Thrown when the loop is configured or driven in a way that violates a structural
 * invariant (empty population, reward vector of the wrong length, rates outside [0, 1],
 * stepping before a reset). Never recovered from: the run halts.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
