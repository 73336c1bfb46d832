package de.anton.wespe.analyser.wespe_analyzer.model;

/**
 * Histogram strategies of {@link DelayEnergyMapBuilder}. Both share the same bin index function.
 */
public enum CountingAlgorithm {
    /** Rows only for observed time keys, each row zero-filled over the full energy range. */
    CLASSIC,
    /** Dense grid over the whole time and energy range, unobserved rows stay zero. */
    VECTORIZED
}
