package de.anton.wespe.analyser.wespe_analyzer.model;

/** The two dimensions of a delay-energy map. */
public enum MapAxis {
    TIME("Time axis"),
    ENERGY("Energy axis");

    private final String label;

    MapAxis(String label) { this.label = label; }

    public String getLabel() { return label; }

    public MapAxis other() { return this == TIME ? ENERGY : TIME; }

    @Override
    public String toString() { return label; }
}
