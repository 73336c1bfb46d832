package de.anton.wespe.analyser.wespe_analyzer.model;

import de.anton.wespe.analyser.wespe_analyzer.algorithms.SavitzkyGolayFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Post-processing of the sequences of a {@link MapCut}. Every operation changes the cut in place
 * and may be combined with the others in any order.
 */
public final class MapCutProcessor {

    private static final Logger logger = LoggerFactory.getLogger(MapCutProcessor.class);

    private MapCutProcessor() {
        throw new IllegalStateException("Utility class");
    }

    /** Savitzky-Golay smoothing of every sequence, repeated {@code cycles} times. */
    public static void smooth(MapCut cut, int windowLength, int polynomialOrder, int cycles) {
        SavitzkyGolayFilter filter = new SavitzkyGolayFilter(windowLength, polynomialOrder);
        for (int i = 0; i < cut.size(); i++) {
            cut.setCut(i, filter.smooth(cut.getCut(i), cycles));
        }
        logger.debug("Smoothed {} cuts (window={}, order={}, cycles={}).", cut.size(), windowLength, polynomialOrder, cycles);
    }

    /** Replaces every sequence by the absolute value of its gradient. */
    public static void derivative(MapCut cut) {
        for (int i = 0; i < cut.size(); i++) {
            double[] values = cut.getCut(i);
            if (values.length < 2) {
                cut.setCut(i, new double[values.length]);
                continue;
            }
            double[] gradient = ArrayStatistics.gradient(values);
            for (int k = 0; k < gradient.length; k++) gradient[k] = Math.abs(gradient[k]);
            cut.setCut(i, gradient);
        }
        cut.markArbitraryUnits();
        logger.debug("Replaced {} cuts by their absolute derivative.", cut.size());
    }

    /** [0, 1] normalization with the global extrema of all sequences. */
    public static void normalizeZeroOne(MapCut cut) {
        double[][] values = cut.getCuts().toArray(new double[0][]);
        MapTransformer.normalizeZeroOne(values);
        for (int i = 0; i < values.length; i++) cut.setCut(i, values[i]);
        cut.markArbitraryUnits();
    }

    /** [-1, 1] normalization by the larger absolute global extremum of all sequences. */
    public static void normalizeMinusOneOne(MapCut cut) {
        double[][] values = cut.getCuts().toArray(new double[0][]);
        MapTransformer.normalizeMinusOneOne(values);
        for (int i = 0; i < values.length; i++) cut.setCut(i, values[i]);
        cut.markArbitraryUnits();
    }

    /** Applies a cut normalization by mode; {@link NormalizationMode#TOTAL_ELECTRON} is only defined for maps. */
    public static void normalize(MapCut cut, NormalizationMode mode) {
        switch (mode) {
            case ZERO_ONE: normalizeZeroOne(cut); break;
            case MINUS_ONE_ONE: normalizeMinusOneOne(cut); break;
            case NONE: break;
            default: throw new IllegalArgumentException("Normalization '" + mode + "' is not available for cuts.");
        }
    }

    /**
     * Stores {@code (cut_k - cut_1) * magnification} for every k > 1 as difference sequences,
     * the cuts themselves stay unchanged.
     */
    public static void difference(MapCut cut, double magnification) {
        List<double[]> differences = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        double[] reference = cut.getCut(0);
        String v = cut.getVariableName();
        for (int i = 1; i < cut.size(); i++) {
            double[] values = cut.getCut(i);
            for (int k = 0; k < values.length; k++) {
                values[k] = (values[k] - reference[k]) * magnification;
            }
            differences.add(values);
            String label = String.format(Locale.ROOT, "Difference %s%d-%s1", v, i + 1, v);
            if (magnification != 1.0) {
                label += String.format(Locale.ROOT, " x %s", magnification);
            }
            labels.add(label);
        }
        cut.setDifferenceCuts(differences, labels);
        logger.debug("Computed {} difference cuts (magnification {}).", differences.size(), magnification);
    }

    /**
     * Stacks the sequences for display. Each pass shifts every sequence (except the first) up by the
     * absolute value of the minimum difference to its predecessor; {@code size - 1} passes are made.
     * Afterwards sequence k is raised by {@code k * offsetFraction * (global max - global min)} when that
     * offset is positive.
     */
    public static void waterfall(MapCut cut, double offsetFraction) {
        int n = cut.size();
        double[][] values = cut.getCuts().toArray(new double[0][]);
        double offset = (MapTransformer.globalMax(values) - MapTransformer.globalMin(values)) * offsetFraction;
        for (int pass = 0; pass < n - 1; pass++) {
            double[] shifts = new double[n];
            for (int i = 1; i < n; i++) {
                double minDelta = Double.POSITIVE_INFINITY;
                for (int k = 0; k < values[i].length; k++) {
                    minDelta = Math.min(minDelta, values[i][k] - values[i - 1][k]);
                }
                shifts[i] = values[i].length == 0 ? 0.0 : Math.abs(minDelta);
            }
            for (int i = 1; i < n; i++) {
                for (int k = 0; k < values[i].length; k++) values[i][k] += shifts[i];
            }
        }
        if (offset > 0) {
            for (int i = 1; i < n; i++) {
                for (int k = 0; k < values[i].length; k++) values[i][k] += offset * i;
            }
        }
        for (int i = 0; i < n; i++) cut.setCut(i, values[i]);
        logger.debug("Waterfall applied to {} cuts, extra offset {}.", n, offset);
    }
}
