package de.anton.wespe.analyser.wespe_analyzer.model;

import java.util.Objects;

/**
 * Two-dimensional electron count histogram: one row per time coordinate, one column per energy coordinate.
 * <p>
 * Each dimension carries several labelings of the same bins. The energy dimension has a kinetic and a
 * binding energy labeling, the time dimension a raw labeling (delay stage value or microbunch id), an
 * optional labeling relative to time zero and a plain row index. {@link #getEnergyAxis()} and
 * {@link #getTimeAxis()} select the active labeling; switching never changes the grid values.
 * <p>
 * Instances are immutable. All {@code with*} methods return modified copies.
 */
public final class DelayEnergyMap {

    private double[][] values;          // [time][energy]
    private double[] kineticEnergy;
    private double[] bindingEnergy;
    private double[] rawTime;
    private double[] relativeTime;      // null until time zero is applied
    private double[] delayIndex;
    private EnergyAxis energyAxis = EnergyAxis.KINETIC;
    private TimeAxis timeAxis;
    private final Ordinate ordinate;
    private final double energyStep;
    private final double timeStep;
    private Double timeZero;
    private final double monoEnergy;
    private boolean normalized;
    private boolean mergeSuccessful = true;
    private MapType type = MapType.MAP;
    private String name;

    private DelayEnergyMap(Ordinate ordinate, double energyStep, double timeStep, double monoEnergy) {
        this.ordinate = Objects.requireNonNull(ordinate, "Ordinate cannot be null");
        this.energyStep = energyStep;
        this.timeStep = timeStep;
        this.monoEnergy = monoEnergy;
        this.timeAxis = ordinate.getRawAxis();
    }

    /**
     * Creates a freshly counted map with kinetic energy and raw time labelings active.
     * Binding energies are derived as {@code mono - kinetic - 4.5 eV} and rounded to the energy step.
     *
     * @param values        counts, {@code values[i][j]} belongs to {@code rawTime[i]} and {@code kineticEnergy[j]}
     * @param kineticEnergy energy coordinates
     * @param rawTime       time coordinates in the ordinate's raw units
     */
    public static DelayEnergyMap of(double[][] values, double[] kineticEnergy, double[] rawTime, Ordinate ordinate,
                                    double energyStep, double timeStep, double monoEnergy, String name) {
        Objects.requireNonNull(values, "Values cannot be null");
        Objects.requireNonNull(kineticEnergy, "Kinetic energy cannot be null");
        Objects.requireNonNull(rawTime, "Raw time cannot be null");
        if (values.length != rawTime.length) {
            throw new IllegalArgumentException(String.format(
                    "Map has %d rows but %d time coordinates.", values.length, rawTime.length));
        }
        for (double[] row : values) {
            if (row.length != kineticEnergy.length) {
                throw new IllegalArgumentException(String.format(
                        "Map row has %d columns but %d energy coordinates.", row.length, kineticEnergy.length));
            }
        }
        DelayEnergyMap map = new DelayEnergyMap(ordinate, energyStep, timeStep, monoEnergy);
        map.values = ArrayStatistics.deepCopy(values);
        map.kineticEnergy = kineticEnergy.clone();
        map.bindingEnergy = bindingFor(kineticEnergy, monoEnergy, energyStep);
        map.rawTime = rawTime.clone();
        map.delayIndex = indexCoordinates(rawTime.length);
        map.name = name;
        return map;
    }

    /** Zero-sized map, used as the placeholder of a failed merge. */
    public static DelayEnergyMap empty(Ordinate ordinate, double energyStep, double timeStep, double monoEnergy, String name) {
        DelayEnergyMap map = of(new double[0][0], new double[0], new double[0], ordinate, energyStep, timeStep, monoEnergy, name);
        map.mergeSuccessful = false;
        return map;
    }

    static double[] bindingFor(double[] kineticEnergy, double monoEnergy, double energyStep) {
        double[] binding = new double[kineticEnergy.length];
        for (int j = 0; j < kineticEnergy.length; j++) {
            binding[j] = BinningUtils.roundToStep(monoEnergy - kineticEnergy[j] - RunMetadata.WORK_FUNCTION_EV, energyStep);
        }
        return binding;
    }

    static double[] indexCoordinates(int size) {
        double[] index = new double[size];
        for (int i = 0; i < size; i++) index[i] = i;
        return index;
    }

    private DelayEnergyMap copy() {
        DelayEnergyMap copy = new DelayEnergyMap(ordinate, energyStep, timeStep, monoEnergy);
        copy.values = values;
        copy.kineticEnergy = kineticEnergy;
        copy.bindingEnergy = bindingEnergy;
        copy.rawTime = rawTime;
        copy.relativeTime = relativeTime;
        copy.delayIndex = delayIndex;
        copy.energyAxis = energyAxis;
        copy.timeAxis = timeAxis;
        copy.timeZero = timeZero;
        copy.normalized = normalized;
        copy.mergeSuccessful = mergeSuccessful;
        copy.type = type;
        copy.name = name;
        return copy;
    }

    // --- Derived copies ---

    /** Same labelings and attributes, new grid values of identical shape. */
    public DelayEnergyMap withValues(double[][] newValues) {
        if (newValues.length != values.length || (newValues.length > 0 && newValues[0].length != getEnergySize())) {
            throw new IllegalArgumentException("New values must keep the map shape "
                    + getTimeSize() + "x" + getEnergySize());
        }
        DelayEnergyMap copy = copy();
        copy.values = ArrayStatistics.deepCopy(newValues);
        return copy;
    }

    public DelayEnergyMap withNormalized(double[][] newValues) {
        DelayEnergyMap copy = withValues(newValues);
        copy.normalized = true;
        return copy;
    }

    public DelayEnergyMap asDifference(double[][] newValues) {
        DelayEnergyMap copy = withValues(newValues);
        copy.type = MapType.DIFFERENCE;
        return copy;
    }

    public DelayEnergyMap withEnergyAxis(EnergyAxis axis) {
        DelayEnergyMap copy = copy();
        copy.energyAxis = Objects.requireNonNull(axis, "Energy axis cannot be null");
        return copy;
    }

    /**
     * Activates another time labeling.
     *
     * @throws IllegalStateException if the labeling does not exist for this map
     */
    public DelayEnergyMap withTimeAxis(TimeAxis axis) {
        Objects.requireNonNull(axis, "Time axis cannot be null");
        switch (axis) {
            case DELAY_STAGE_VALUES:
            case MICROBUNCH_ID:
                if (ordinate.getRawAxis() != axis) {
                    throw new IllegalStateException("Time axis '" + axis + "' is not available for a "
                            + ordinate + " map, use '" + ordinate.getRawAxis() + "'.");
                }
                break;
            case DELAY_RELATIVE_T0:
                if (relativeTime == null) {
                    throw new IllegalStateException("Time zero has not been set, 'Delay relative t0' is not available.");
                }
                break;
            default:
                break;
        }
        DelayEnergyMap copy = copy();
        copy.timeAxis = axis;
        return copy;
    }

    /** Stores the labeling relative to time zero and makes it active. */
    public DelayEnergyMap withRelativeTime(double t0, double[] relative) {
        if (relative.length != rawTime.length) {
            throw new IllegalArgumentException("Relative time must have one value per row.");
        }
        DelayEnergyMap copy = copy();
        copy.timeZero = t0;
        copy.relativeTime = relative.clone();
        copy.timeAxis = TimeAxis.DELAY_RELATIVE_T0;
        return copy;
    }

    public DelayEnergyMap withName(String newName) {
        DelayEnergyMap copy = copy();
        copy.name = newName;
        return copy;
    }

    /** Renumbers the row index labeling 0..n-1 in the current row order. */
    DelayEnergyMap withReindexedRows() {
        DelayEnergyMap copy = copy();
        copy.delayIndex = indexCoordinates(getTimeSize());
        return copy;
    }

    DelayEnergyMap withMergeSuccessful(boolean successful) {
        DelayEnergyMap copy = copy();
        copy.mergeSuccessful = successful;
        return copy;
    }

    /** Rows and columns at the given indices, in the given order; every labeling is sliced alike. */
    public DelayEnergyMap subset(int[] timeRows, int[] energyColumns) {
        DelayEnergyMap copy = copy();
        double[][] sub = new double[timeRows.length][energyColumns.length];
        for (int i = 0; i < timeRows.length; i++) {
            for (int j = 0; j < energyColumns.length; j++) {
                sub[i][j] = values[timeRows[i]][energyColumns[j]];
            }
        }
        copy.values = sub;
        copy.kineticEnergy = pick(kineticEnergy, energyColumns);
        copy.bindingEnergy = pick(bindingEnergy, energyColumns);
        copy.rawTime = pick(rawTime, timeRows);
        copy.relativeTime = relativeTime != null ? pick(relativeTime, timeRows) : null;
        copy.delayIndex = pick(delayIndex, timeRows);
        return copy;
    }

    /** The same map with the energy columns in reverse order. */
    public DelayEnergyMap reversedEnergy() {
        int[] columns = new int[getEnergySize()];
        for (int j = 0; j < columns.length; j++) columns[j] = columns.length - 1 - j;
        return subset(allRows(), columns);
    }

    int[] allRows() {
        int[] rows = new int[getTimeSize()];
        for (int i = 0; i < rows.length; i++) rows[i] = i;
        return rows;
    }

    int[] allColumns() {
        int[] columns = new int[getEnergySize()];
        for (int j = 0; j < columns.length; j++) columns[j] = j;
        return columns;
    }

    private static double[] pick(double[] source, int[] indices) {
        double[] result = new double[indices.length];
        for (int k = 0; k < indices.length; k++) result[k] = source[indices[k]];
        return result;
    }

    // --- Coordinates ---

    /** Coordinates of the active energy labeling. */
    public double[] getEnergyCoordinates() { return getEnergyCoordinates(energyAxis); }

    public double[] getEnergyCoordinates(EnergyAxis axis) {
        return (axis == EnergyAxis.BINDING ? bindingEnergy : kineticEnergy).clone();
    }

    /** Coordinates of the active time labeling. */
    public double[] getTimeCoordinates() { return getTimeCoordinates(timeAxis); }

    public double[] getTimeCoordinates(TimeAxis axis) {
        switch (axis) {
            case DELAY_RELATIVE_T0:
                if (relativeTime == null) {
                    throw new IllegalStateException("Time zero has not been set for map " + name);
                }
                return relativeTime.clone();
            case DELAY_INDEX:
                return delayIndex.clone();
            default:
                return rawTime.clone();
        }
    }

    public double[] getCoordinates(MapAxis axis) {
        return axis == MapAxis.TIME ? getTimeCoordinates() : getEnergyCoordinates();
    }

    // --- Getters ---
    public double[][] getValues() { return ArrayStatistics.deepCopy(values); }
    public double getValue(int timeRow, int energyColumn) { return values[timeRow][energyColumn]; }
    public double[] getRow(int timeRow) { return values[timeRow].clone(); }
    public int getTimeSize() { return values.length; }
    public int getEnergySize() { return kineticEnergy.length; }
    public boolean isDegenerate() { return getTimeSize() == 0 || getEnergySize() == 0; }
    public EnergyAxis getEnergyAxis() { return energyAxis; }
    public TimeAxis getTimeAxis() { return timeAxis; }
    public Ordinate getOrdinate() { return ordinate; }
    public double getEnergyStep() { return energyStep; }
    public double getTimeStep() { return timeStep; }
    public Double getTimeZero() { return timeZero; }
    public boolean hasRelativeTime() { return relativeTime != null; }
    public double getMonoEnergy() { return monoEnergy; }
    public boolean isNormalized() { return normalized; }
    public boolean isMergeSuccessful() { return mergeSuccessful; }
    public MapType getType() { return type; }
    public String getName() { return name; }
    public String getTimeUnits() { return timeAxis == TimeAxis.DELAY_INDEX ? "u." : ordinate.getUnits(); }
    public String getEnergyUnits() { return "eV"; }

    /** Sum of all non-NaN cells. */
    public double total() {
        double sum = 0.0;
        for (double[] row : values) sum += ArrayStatistics.nanSum(row);
        return sum;
    }

    @Override
    public String toString() {
        return String.format("DelayEnergyMap[%s, %dx%d, %s/%s, type=%s, normalized=%s, merged=%s]",
                name, getTimeSize(), getEnergySize(), energyAxis, timeAxis, type, normalized, mergeSuccessful);
    }
}
