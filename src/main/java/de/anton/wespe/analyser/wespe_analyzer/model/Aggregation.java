package de.anton.wespe.analyser.wespe_analyzer.model;

/** How the lines inside a cut band are collapsed into one sequence. */
public enum Aggregation {
    MEAN,
    SUM
}
