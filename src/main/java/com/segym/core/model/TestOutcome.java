package com.segym.core.model;

public enum TestOutcome {
    PASSED,
    FAILED,
    ERROR,
    SKIPPED
}
