package de.anton.wespe.analyser.wespe_analyzer.model;

/**
 * Labelings of the energy dimension of a {@link DelayEnergyMap}.
 */
public enum EnergyAxis {
    KINETIC("Kinetic energy"),
    BINDING("Binding energy");

    private final String label;

    EnergyAxis(String label) { this.label = label; }

    public String getLabel() { return label; }

    @Override
    public String toString() { return label; }
}
