package de.anton.wespe.analyser.wespe_analyzer.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding of raw energy and time values onto a step grid.
 * Every histogram bin and every exported coordinate goes through {@link #roundToStep(double, double)},
 * so displayed values always land on a multiple of the step.
 */
public final class BinningUtils {

    // Tolerance for the half-up comparison, absorbs representation error of x/step
    private static final double HALF_TOLERANCE = 1e-9;

    private BinningUtils() {
        throw new IllegalStateException("Utility class should not be instantiated.");
    }

    /**
     * Rounds {@code x} to the nearest multiple of {@code step}, ties rounding up.
     * The result is cleaned to the decimal precision of the step (0.05 -> 2 decimals).
     *
     * @param x    raw value; NaN and infinities are returned unchanged
     * @param step positive, finite step
     * @return the step multiple closest to x
     */
    public static double roundToStep(double x, double step) {
        requireValidStep(step);
        if (Double.isNaN(x) || Double.isInfinite(x)) {
            return x;
        }
        double quotient = x / step;
        double floor = Math.floor(quotient);
        double result = floor * step;
        if (quotient - floor >= 0.5 - HALF_TOLERANCE) {
            result += step;
        }
        return roundToDecimals(result, decimals(step));
    }

    /** Element-wise {@link #roundToStep(double, double)}; returns a new array. */
    public static double[] roundToStep(double[] values, double step) {
        requireValidStep(step);
        double[] rounded = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            rounded[i] = roundToStep(values[i], step);
        }
        return rounded;
    }

    /**
     * Number of decimal places of a step as written (0.1 -> 1, 0.05 -> 2, 1 -> 0).
     */
    public static int decimals(double step) {
        BigDecimal plain = BigDecimal.valueOf(step).stripTrailingZeros();
        return Math.max(0, plain.scale());
    }

    public static double roundToDecimals(double value, int decimals) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        double rounded = BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
        return rounded == 0.0 ? 0.0 : rounded; // no negative zero in coordinates
    }

    /**
     * Canonical bin index of an already rounded value relative to the grid origin.
     * Both counting algorithms use this instead of floating point equality.
     */
    public static int binIndex(double roundedValue, double origin, double step) {
        return (int) Math.round((roundedValue - origin) / step);
    }

    /** Grid coordinate {@code origin + index * step}, cleaned to the step's precision. */
    public static double coordinate(double origin, int index, double step) {
        return roundToDecimals(origin + index * step, decimals(step));
    }

    public static void requireValidStep(double step) {
        if (!(step > 0) || Double.isInfinite(step)) {
            throw new IllegalArgumentException("Step must be a positive finite number, got: " + step);
        }
    }
}
