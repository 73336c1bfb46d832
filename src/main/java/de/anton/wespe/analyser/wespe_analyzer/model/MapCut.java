package de.anton.wespe.analyser.wespe_analyzer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * One-dimensional slices of a {@link DelayEnergyMap}, created by {@link MapCutExtractor}.
 * <p>
 * A cut integrates a band around each requested position along {@link #getCutAxis()}; the sequences run
 * along the other axis and share one coordinate array. The cut keeps copies of everything it needs and
 * never refers back to its map. {@link MapCutProcessor} changes the sequences in place.
 */
public class MapCut {

    private final List<Double> positions;
    private final List<Double> widths;
    private final List<double[]> cuts;
    private final List<Boolean> hasData;
    private final double[] coordinates;
    private final MapAxis cutAxis;
    private final EnergyAxis energyAxis;
    private final TimeAxis timeAxis;
    private final Ordinate ordinate;
    private final String positionUnits;
    private final String coordinateUnits;
    private final double energyStep;
    private final double timeStep;
    private final String mapName;

    private boolean arbitraryUnits;
    private List<double[]> differenceCuts = new ArrayList<>();
    private List<String> differenceLabels = new ArrayList<>();
    private PeakFitResult fit; // null until a fit converged

    MapCut(DelayEnergyMap source, MapAxis cutAxis, double[] coordinates) {
        this.cutAxis = cutAxis;
        this.coordinates = coordinates.clone();
        this.energyAxis = source.getEnergyAxis();
        this.timeAxis = source.getTimeAxis();
        this.ordinate = source.getOrdinate();
        this.energyStep = source.getEnergyStep();
        this.timeStep = source.getTimeStep();
        this.mapName = source.getName();
        this.positionUnits = cutAxis == MapAxis.TIME ? source.getTimeUnits() : source.getEnergyUnits();
        this.coordinateUnits = cutAxis == MapAxis.TIME ? source.getEnergyUnits() : source.getTimeUnits();
        this.arbitraryUnits = source.isNormalized();
        this.positions = new ArrayList<>();
        this.widths = new ArrayList<>();
        this.cuts = new ArrayList<>();
        this.hasData = new ArrayList<>();
    }

    void addSlice(double position, double width, double[] values, boolean withData) {
        positions.add(position);
        widths.add(width);
        cuts.add(values);
        hasData.add(withData);
    }

    /** Letter naming the cut positions: T for delays, MB for microbunches, E for energies. */
    public String getVariableName() {
        if (cutAxis == MapAxis.ENERGY) return "E";
        return ordinate == Ordinate.MICROBUNCH && timeAxis != TimeAxis.DELAY_INDEX ? "MB" : "T";
    }

    /** Letter naming the coordinate running along the sequences (E or T). */
    public String getCoordinateVariableName() {
        return cutAxis == MapAxis.TIME ? "E" : "T";
    }

    /** Legend label of slice {@code index}, e.g. {@code T1 = 1.5 ps, dT1 = 0.5 ps}. */
    public String getLabel(int index) {
        String v = getVariableName();
        return String.format(Locale.ROOT, "%s%d = %s %s, d%s%d = %s %s",
                v, index + 1, positions.get(index), positionUnits, v, index + 1, widths.get(index), positionUnits);
    }

    // --- Mutators used by the processor and the fitter ---
    void setCut(int index, double[] values) { cuts.set(index, values); }
    void markArbitraryUnits() { this.arbitraryUnits = true; }
    void setDifferenceCuts(List<double[]> newCuts, List<String> labels) {
        this.differenceCuts = new ArrayList<>(newCuts);
        this.differenceLabels = new ArrayList<>(labels);
    }
    void setFit(PeakFitResult fit) { this.fit = fit; }

    // --- Getters ---
    public int size() { return cuts.size(); }
    public double[] getCut(int index) { return cuts.get(index).clone(); }
    public List<double[]> getCuts() {
        List<double[]> copy = new ArrayList<>(cuts.size());
        for (double[] c : cuts) copy.add(c.clone());
        return copy;
    }
    public boolean hasData(int index) { return hasData.get(index); }
    public List<Double> getPositions() { return Collections.unmodifiableList(positions); }
    public List<Double> getWidths() { return Collections.unmodifiableList(widths); }
    public double[] getCoordinates() { return coordinates.clone(); }
    public MapAxis getCutAxis() { return cutAxis; }
    public EnergyAxis getEnergyAxis() { return energyAxis; }
    public TimeAxis getTimeAxis() { return timeAxis; }
    public Ordinate getOrdinate() { return ordinate; }
    public String getPositionUnits() { return positionUnits; }
    public String getCoordinateUnits() { return coordinateUnits; }
    public double getEnergyStep() { return energyStep; }
    public double getTimeStep() { return timeStep; }
    public String getMapName() { return mapName; }
    public boolean isArbitraryUnits() { return arbitraryUnits; }
    public List<double[]> getDifferenceCuts() { return Collections.unmodifiableList(differenceCuts); }
    public List<String> getDifferenceLabels() { return Collections.unmodifiableList(differenceLabels); }
    public boolean hasFit() { return fit != null; }
    public PeakFitResult getFit() { return fit; }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "MapCut[%s across %s, positions=%s, widths=%s]",
                mapName, cutAxis, positions, widths);
    }
}
