package de.anton.wespe.analyser.wespe_analyzer.model;

import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.Arrays;

/**
 * NaN-aware helpers over plain double arrays used by the map and cut operations.
 */
public final class ArrayStatistics {

    private ArrayStatistics() {
        throw new IllegalStateException("Utility class");
    }

    /**
     * Discrete gradient with unit spacing: central differences inside,
     * one-sided differences at both ends.
     *
     * @throws IllegalArgumentException if fewer than two values are given
     */
    public static double[] gradient(double[] values) {
        int n = values.length;
        if (n < 2) {
            throw new IllegalArgumentException("Gradient needs at least 2 values, got " + n);
        }
        double[] result = new double[n];
        result[0] = values[1] - values[0];
        result[n - 1] = values[n - 1] - values[n - 2];
        for (int i = 1; i < n - 1; i++) {
            result[i] = (values[i + 1] - values[i - 1]) / 2.0;
        }
        return result;
    }

    /** Median of the non-NaN values, NaN if there are none. */
    public static double median(double[] values) {
        double[] valid = withoutNaN(values);
        if (valid.length == 0) {
            return Double.NaN;
        }
        return new Median().evaluate(valid);
    }

    /** Absolute median step of a coordinate array; 1 when the array is too short for a gradient. */
    public static double medianStep(double[] coordinates) {
        if (coordinates.length < 2) {
            return 1.0;
        }
        return Math.abs(median(gradient(coordinates)));
    }

    public static double nanMin(double[] values) {
        double min = Double.NaN;
        for (double v : values) {
            if (!Double.isNaN(v) && (Double.isNaN(min) || v < min)) min = v;
        }
        return min;
    }

    public static double nanMax(double[] values) {
        double max = Double.NaN;
        for (double v : values) {
            if (!Double.isNaN(v) && (Double.isNaN(max) || v > max)) max = v;
        }
        return max;
    }

    public static double nanSum(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            if (!Double.isNaN(v)) sum += v;
        }
        return sum;
    }

    /** Mean of the non-NaN values, NaN if there are none. */
    public static double nanMean(double[] values) {
        double sum = 0.0;
        int count = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) { sum += v; count++; }
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    public static boolean allNaN(double[] values) {
        for (double v : values) {
            if (!Double.isNaN(v)) return false;
        }
        return true;
    }

    /** Index of the largest non-NaN value, -1 if all values are NaN. */
    public static int nanArgMax(double[] values) {
        int index = -1;
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) continue;
            if (index == -1 || values[i] > values[index]) index = i;
        }
        return index;
    }

    public static double[] column(double[][] grid, int column) {
        double[] result = new double[grid.length];
        for (int i = 0; i < grid.length; i++) {
            result[i] = grid[i][column];
        }
        return result;
    }

    public static double[][] deepCopy(double[][] grid) {
        double[][] copy = new double[grid.length][];
        for (int i = 0; i < grid.length; i++) {
            copy[i] = Arrays.copyOf(grid[i], grid[i].length);
        }
        return copy;
    }

    private static double[] withoutNaN(double[] values) {
        return Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
    }
}
