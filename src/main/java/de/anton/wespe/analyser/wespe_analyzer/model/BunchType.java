package de.anton.wespe.analyser.wespe_analyzer.model;

/** Bunch id used by the bunch filter. */
public enum BunchType {
    /** Range given in percent of the observed macrobunch id span. */
    MACRO("Macro_B"),
    /** Range given in absolute microbunch ids. */
    MICRO("Micro_B");

    private final String labelSuffix;

    BunchType(String labelSuffix) { this.labelSuffix = labelSuffix; }

    /** Filter label used in cache keys when no range is applied, e.g. {@code All_Macro_B}. */
    public String unfilteredLabel() { return "All_" + labelSuffix; }

    public String rangeLabel(double min, double max) {
        return (int) min + "-" + (int) max + "_" + labelSuffix;
    }
}
