package de.anton.wespe.analyser.wespe_analyzer.model;

import java.util.Objects;

/**
 * One loaded acquisition run: its events, the metadata derived at load time,
 * the labels of the bunch filters applied so far and the map built from it.
 */
public class Run {

    private final EventSet events;
    private final RunMetadata metadata;
    private String macroFilterLabel = BunchType.MACRO.unfilteredLabel();
    private String microFilterLabel = BunchType.MICRO.unfilteredLabel();
    private DelayEnergyMap map; // null until built

    public Run(EventSet events, RunMetadata metadata) {
        this.events = Objects.requireNonNull(events, "Events cannot be null");
        this.metadata = Objects.requireNonNull(metadata, "Metadata cannot be null");
    }

    public EventSet getEvents() { return events; }
    public RunMetadata getMetadata() { return metadata; }
    public String getRunId() { return metadata.getRunId(); }
    public String getMacroFilterLabel() { return macroFilterLabel; }
    public String getMicroFilterLabel() { return microFilterLabel; }
    public String getFilterLabel(BunchType type) { return type == BunchType.MACRO ? macroFilterLabel : microFilterLabel; }
    public DelayEnergyMap getMap() { return map; }
    public boolean hasMap() { return map != null; }

    void setFilterLabel(BunchType type, String label) {
        if (type == BunchType.MACRO) {
            this.macroFilterLabel = label;
        } else {
            this.microFilterLabel = label;
        }
    }

    public void setMap(DelayEnergyMap map) { this.map = map; }

    @Override
    public String toString() {
        return "Run{" + metadata.getRunId() + ", events=" + events.size()
                + ", filters=" + macroFilterLabel + "/" + microFilterLabel + "}";
    }
}
