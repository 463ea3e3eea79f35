package com.segym.sandbox;

/**
 * A sandbox could not be started, crashed, or did not finish in time.
 */
public class SandboxException extends RuntimeException {

    public SandboxException(String message) {
        super(message);
    }

    public SandboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
