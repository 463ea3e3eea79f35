package com.segym.core.evolution;

/**
 * Which end of the reward scale counts as better during selection.
 */
public enum SelectionDirection {

    /** Lower rewards are better, e.g. failing-test counts. */
    MINIMIZE,

    /** Higher rewards are better. */
    MAXIMIZE;

    /** True when {@code a} is strictly better than {@code b}. */
    public boolean isBetter(double a, double b) {
        return this == MINIMIZE ? a < b : a > b;
    }
}
