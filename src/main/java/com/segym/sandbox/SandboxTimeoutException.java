package com.segym.sandbox;

/**
 * The test command did not finish within the per-candidate timeout.
 */
public class SandboxTimeoutException extends SandboxException {

    public SandboxTimeoutException(String message) {
        super(message);
    }
}
