package de.anton.wespe.analyser.wespe_analyzer.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Map level transformations. Every method returns a new {@link DelayEnergyMap}; the input is left untouched.
 */
public final class MapTransformer {

    private static final Logger logger = LoggerFactory.getLogger(MapTransformer.class);

    /** Rows at or before this many median time steps (on the active time axis) form the difference baseline. */
    public static final double BASELINE_STEPS = -2.5;

    private static final double BOUND_TOLERANCE = 1e-9;

    private MapTransformer() {
        throw new IllegalStateException("Utility class");
    }

    public static DelayEnergyMap switchEnergyAxis(DelayEnergyMap map, EnergyAxis axis) {
        return map.withEnergyAxis(axis);
    }

    public static DelayEnergyMap switchTimeAxis(DelayEnergyMap map, TimeAxis axis) {
        return map.withTimeAxis(axis);
    }

    /**
     * Adds the labeling {@code t0 - rawTime} (both rounded to the time step) and makes it active.
     *
     * @throws IllegalStateException for maps whose time dimension is not a delay scan
     */
    public static DelayEnergyMap applyTimeZero(DelayEnergyMap map, double t0) {
        if (map.getOrdinate() != Ordinate.DELAY) {
            throw new IllegalStateException("Time zero can only be applied to delay scans, map '"
                    + map.getName() + "' uses " + map.getOrdinate());
        }
        if (Double.isNaN(t0) || Double.isInfinite(t0)) {
            throw new IllegalArgumentException("Time zero must be a finite number, got: " + t0);
        }
        double step = map.getTimeStep();
        double roundedT0 = BinningUtils.roundToStep(t0, step);
        double[] raw = map.getTimeCoordinates(TimeAxis.DELAY_STAGE_VALUES);
        double[] relative = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            relative[i] = BinningUtils.roundToStep(roundedT0 - raw[i], step);
        }
        logger.info("Time zero set to {} {} for map '{}'.", roundedT0, map.getOrdinate().getUnits(), map.getName());
        return map.withRelativeTime(roundedT0, relative);
    }

    /**
     * Subtracts the mean of the baseline rows from every row. Baseline rows are those whose active time
     * coordinate is at most {@code -2.5 * |median time step|}.
     *
     * @throws IllegalStateException if no row lies in the baseline window
     */
    public static DelayEnergyMap differenceMap(DelayEnergyMap map) {
        double[] time = map.getTimeCoordinates();
        double threshold = BASELINE_STEPS * ArrayStatistics.medianStep(time);
        List<Integer> baselineRows = new ArrayList<>();
        for (int i = 0; i < time.length; i++) {
            if (time[i] <= threshold + BOUND_TOLERANCE) baselineRows.add(i);
        }
        if (baselineRows.isEmpty()) {
            throw new IllegalStateException(String.format(
                    "No time rows at or before %s %s on axis '%s', cannot build a difference map for '%s'.",
                    threshold, map.getTimeUnits(), map.getTimeAxis(), map.getName()));
        }
        int energyBins = map.getEnergySize();
        double[] baseline = new double[energyBins];
        for (int j = 0; j < energyBins; j++) {
            double[] column = new double[baselineRows.size()];
            for (int k = 0; k < column.length; k++) column[k] = map.getValue(baselineRows.get(k), j);
            baseline[j] = ArrayStatistics.nanMean(column);
        }
        double[][] values = map.getValues();
        for (double[] row : values) {
            for (int j = 0; j < energyBins; j++) row[j] -= baseline[j];
        }
        logger.info("Difference map of '{}' computed against {} baseline rows (t <= {}).",
                map.getName(), baselineRows.size(), threshold);
        return map.asDifference(values);
    }

    /** Applies one of the intensity normalizations; {@link NormalizationMode#NONE} returns the map as is. */
    public static DelayEnergyMap normalize(DelayEnergyMap map, NormalizationMode mode) {
        Objects.requireNonNull(mode, "Normalization mode cannot be null");
        switch (mode) {
            case TOTAL_ELECTRON: return map.withNormalized(normalizeTotalElectron(map.getValues()));
            case ZERO_ONE: return map.withNormalized(normalizeZeroOne(map.getValues()));
            case MINUS_ONE_ONE: return map.withNormalized(normalizeMinusOneOne(map.getValues()));
            default: return map;
        }
    }

    /**
     * Divides each row by its own sum and multiplies it by the mean row sum.
     * Rows summing to zero stay zero.
     */
    static double[][] normalizeTotalElectron(double[][] values) {
        double[] rowSums = new double[values.length];
        for (int i = 0; i < values.length; i++) rowSums[i] = ArrayStatistics.nanSum(values[i]);
        double meanSum = ArrayStatistics.nanMean(rowSums);
        for (int i = 0; i < values.length; i++) {
            for (int j = 0; j < values[i].length; j++) {
                values[i][j] = rowSums[i] == 0.0 ? 0.0 : values[i][j] / rowSums[i] * meanSum;
            }
        }
        return values;
    }

    /** Shifts by the global minimum and divides by the new global maximum; a constant grid becomes 0.5. */
    public static double[][] normalizeZeroOne(double[][] values) {
        double min = globalMin(values);
        double range = globalMax(values) - min;
        for (double[] row : values) {
            for (int j = 0; j < row.length; j++) {
                if (Double.isNaN(row[j])) continue;
                row[j] = range == 0.0 ? 0.5 : (row[j] - min) / range;
            }
        }
        if (range == 0.0) {
            logger.debug("[0, 1] normalization of a constant grid, all values set to 0.5.");
        }
        return values;
    }

    /** Divides by the larger absolute global extremum; an all-zero grid is returned unchanged. */
    public static double[][] normalizeMinusOneOne(double[][] values) {
        double norm = Math.max(Math.abs(globalMax(values)), Math.abs(globalMin(values)));
        if (norm == 0.0 || Double.isNaN(norm)) {
            logger.debug("[-1, 1] normalization skipped, grid has no non-zero value.");
            return values;
        }
        for (double[] row : values) {
            for (int j = 0; j < row.length; j++) row[j] /= norm;
        }
        return values;
    }

    static double globalMin(double[][] values) {
        double min = Double.NaN;
        for (double[] row : values) {
            double rowMin = ArrayStatistics.nanMin(row);
            if (!Double.isNaN(rowMin) && (Double.isNaN(min) || rowMin < min)) min = rowMin;
        }
        return min;
    }

    static double globalMax(double[][] values) {
        double max = Double.NaN;
        for (double[] row : values) {
            double rowMax = ArrayStatistics.nanMax(row);
            if (!Double.isNaN(rowMax) && (Double.isNaN(max) || rowMax > max)) max = rowMax;
        }
        return max;
    }

    /**
     * Keeps the rows (time) or columns (energy) whose active coordinate lies within the inclusive bounds.
     * Selection is by value, so it works for ascending and descending coordinates alike and keeps their order.
     *
     * @param bounds two values; their order does not matter
     * @throws IllegalArgumentException if the bounds are not finite or equal
     */
    public static DelayEnergyMap clip(DelayEnergyMap map, double[] bounds, MapAxis axis) {
        if (bounds == null || bounds.length != 2) {
            throw new IllegalArgumentException("ROI needs exactly two bounds.");
        }
        return clip(map, Math.min(bounds[0], bounds[1]), Math.max(bounds[0], bounds[1]), axis);
    }

    /**
     * @throws IllegalArgumentException if {@code low >= high} or a bound is not finite
     */
    public static DelayEnergyMap clip(DelayEnergyMap map, double low, double high, MapAxis axis) {
        if (!Double.isFinite(low) || !Double.isFinite(high)) {
            throw new IllegalArgumentException("ROI bounds must be finite numbers, got [" + low + ", " + high + "]");
        }
        if (low >= high) {
            throw new IllegalArgumentException("ROI lower bound must be below the upper bound, got [" + low + ", " + high + "]");
        }
        double[] coordinates = map.getCoordinates(axis);
        int[] selected = IntStream.range(0, coordinates.length)
                .filter(i -> coordinates[i] >= low - BOUND_TOLERANCE && coordinates[i] <= high + BOUND_TOLERANCE)
                .toArray();
        logger.debug("ROI [{}, {}] on {} ({}) keeps {} of {} lines.", low, high, axis,
                axis == MapAxis.TIME ? map.getTimeAxis() : map.getEnergyAxis(), selected.length, coordinates.length);
        return axis == MapAxis.TIME ? map.subset(selected, map.allColumns()) : map.subset(map.allRows(), selected);
    }
}
