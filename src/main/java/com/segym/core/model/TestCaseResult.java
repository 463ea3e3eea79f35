package com.segym.core.model;

import java.io.Serializable;

/**
 * Result of one test case.
 *
 * @param name    fully qualified test name ({@code classname.name})
 * @param outcome pass/fail classification
 * @param message failure or skip message, null when passed
 */
public record TestCaseResult(
    String name,
    TestOutcome outcome,
    String message
) implements Serializable {}
