package de.anton.wespe.analyser.wespe_analyzer.model;

/**
 * Labelings of the time dimension of a {@link DelayEnergyMap}.
 * DELAY_STAGE_VALUES and MICROBUNCH_ID both point at the raw ordinate values,
 * which one applies depends on the map's {@link Ordinate}.
 */
public enum TimeAxis {
    DELAY_STAGE_VALUES("Delay stage values"),
    DELAY_RELATIVE_T0("Delay relative t0"),
    MICROBUNCH_ID("MicroBunch ID"),
    DELAY_INDEX("Delay index");

    private final String label;

    TimeAxis(String label) { this.label = label; }

    public String getLabel() { return label; }

    @Override
    public String toString() { return label; }
}
