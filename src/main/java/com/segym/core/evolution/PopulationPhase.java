package com.segym.core.evolution;

/**
 * Lifecycle of one generation.
 */
public enum PopulationPhase {
    INITIALIZED,
    SAMPLING,
    EVALUATED,
    EVOLVED
}
