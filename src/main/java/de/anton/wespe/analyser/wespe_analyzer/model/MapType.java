package de.anton.wespe.analyser.wespe_analyzer.model;

/** Semantic type of the values held by a {@link DelayEnergyMap}. */
public enum MapType {
    MAP,
    DIFFERENCE
}
