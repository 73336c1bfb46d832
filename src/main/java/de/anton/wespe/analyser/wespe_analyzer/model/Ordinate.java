package de.anton.wespe.analyser.wespe_analyzer.model;

/**
 * The event quantity used as the time dimension of a map.
 */
public enum Ordinate {
    /** Delay stage position of a pump-probe scan, in picoseconds. */
    DELAY("ps", "Delay step", TimeAxis.DELAY_STAGE_VALUES),
    /** Microbunch id inside a macrobunch, arbitrary units. */
    MICROBUNCH("u.", "MicroBunch step", TimeAxis.MICROBUNCH_ID);

    private final String units;
    private final String stepLabel;
    private final TimeAxis rawAxis;

    Ordinate(String units, String stepLabel, TimeAxis rawAxis) {
        this.units = units;
        this.stepLabel = stepLabel;
        this.rawAxis = rawAxis;
    }

    public String getUnits() { return units; }
    public String getStepLabel() { return stepLabel; }
    /** Time labeling that shows the raw ordinate values. */
    public TimeAxis getRawAxis() { return rawAxis; }
}
