package com.segym.sandbox;

/**
 * An action's edit cannot be applied to the tree.
 */
public class MalformedPatchException extends RuntimeException {

    public MalformedPatchException(String message) {
        super(message);
    }

    public MalformedPatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
