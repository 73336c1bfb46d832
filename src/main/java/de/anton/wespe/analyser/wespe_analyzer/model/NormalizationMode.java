package de.anton.wespe.analyser.wespe_analyzer.model;

/**
 * Enumeration defining the available intensity normalizations for maps and cuts.
 * Includes a display name for summaries and exported headers.
 */
public enum NormalizationMode {
    NONE("None"),                          // Values left as counted
    TOTAL_ELECTRON("Total electron yield"), // Every time row carries the same number of electrons (maps only)
    ZERO_ONE("[0, 1]"),                    // Shift by global minimum, divide by new global maximum
    MINUS_ONE_ONE("[-1, 1]");              // Divide by the larger absolute global extremum

    private final String displayName;

    NormalizationMode(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
