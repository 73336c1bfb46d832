package de.anton.wespe.analyser.wespe_analyzer.service;

import de.anton.wespe.analyser.wespe_analyzer.algorithms.SavitzkyGolayFilter;
import de.anton.wespe.analyser.wespe_analyzer.model.*;

import java.nio.file.Path;
import java.util.List;

/**
 * Immutable configuration object holding all parameters of a reduction: which runs to load, how to bin
 * and filter them, how to present the combined map and which cuts to take from it.
 * Optional ranges and time zero are null when unused.
 */
public record ReductionConfiguration(
    String runDirectory,
    List<String> runIds,
    String detector,
    double energyStep,             // eV
    double timeStep,               // ps, ignored for the microbunch ordinate
    Ordinate ordinate,
    CountingAlgorithm countingAlgorithm,
    boolean removeOutliers,
    double[] macroBunchRange,      // percent of the macrobunch span
    double[] microBunchRange,      // absolute microbunch ids
    Double timeZero,               // raw delay stage value, ps
    boolean differenceMap,
    EnergyAxis energyAxis,
    TimeAxis timeAxis,
    NormalizationMode mapNormalization,
    double[] energyRoi,
    double[] timeRoi,
    boolean cacheEnabled,
    String cacheDirectory,
    MapAxis cutAxis,
    String cutPositions,           // numbers, "main" or "sb[,hv]"; empty for no cuts
    List<Double> cutWidths,
    Aggregation cutAggregation,
    NormalizationMode cutNormalization,
    boolean smoothing,
    int smoothWindow,
    int smoothOrder,
    int smoothCycles,
    boolean derivative,
    boolean cutDifference,
    double differenceMagnification,
    boolean waterfall,
    double waterfallOffset,
    boolean peakFit,
    String outputDirectory,
    boolean exportAscii,
    boolean exportWorkbook,
    boolean exportChart
) {

    public ReductionConfiguration {
        runIds = runIds == null ? List.of() : List.copyOf(runIds);
        cutWidths = cutWidths == null ? List.of() : List.copyOf(cutWidths);
        if (detector == null || detector.isBlank()) detector = "DLD4Q";
        if (ordinate == null) ordinate = Ordinate.DELAY;
        if (countingAlgorithm == null) countingAlgorithm = CountingAlgorithm.CLASSIC;
        if (energyAxis == null) energyAxis = EnergyAxis.KINETIC;
        if (timeAxis == null || timeAxis == TimeAxis.DELAY_STAGE_VALUES || timeAxis == TimeAxis.MICROBUNCH_ID) {
            timeAxis = ordinate.getRawAxis();
        }
        if (mapNormalization == null) mapNormalization = NormalizationMode.NONE;
        if (cutAxis == null) cutAxis = MapAxis.TIME;
        if (cutAggregation == null) cutAggregation = Aggregation.MEAN;
        if (cutNormalization == null) cutNormalization = NormalizationMode.NONE;
        if (cutPositions == null) cutPositions = "";

        BinningUtils.requireValidStep(energyStep);
        if (ordinate == Ordinate.DELAY) {
            BinningUtils.requireValidStep(timeStep);
        }
        requireRange("macroBunchRange", macroBunchRange, true);
        requireRange("microBunchRange", microBunchRange, true);
        requireRange("energyRoi", energyRoi, false);
        requireRange("timeRoi", timeRoi, false);
        if (timeZero != null && !Double.isFinite(timeZero)) {
            throw new IllegalArgumentException("Time zero must be finite, got " + timeZero);
        }
        if (timeZero != null && ordinate != Ordinate.DELAY) {
            throw new IllegalArgumentException("Time zero needs the delay ordinate.");
        }
        if (timeAxis == TimeAxis.DELAY_RELATIVE_T0 && timeZero == null) {
            throw new IllegalArgumentException("Time axis '" + timeAxis + "' needs a time zero.");
        }
        for (Double width : cutWidths) {
            if (width == null || !(width > 0) || Double.isInfinite(width)) {
                throw new IllegalArgumentException("Cut widths must be positive, got " + cutWidths);
            }
        }
        if (cutNormalization == NormalizationMode.TOTAL_ELECTRON) {
            throw new IllegalArgumentException("Total electron normalization is only available for maps.");
        }
        SavitzkyGolayFilter.validate(smoothWindow, smoothOrder);
        if (smoothCycles < 1) {
            throw new IllegalArgumentException("Smoothing cycles must be at least 1, got " + smoothCycles);
        }
        if (!Double.isFinite(differenceMagnification)) {
            throw new IllegalArgumentException("Difference magnification must be finite.");
        }
        if (!Double.isFinite(waterfallOffset) || waterfallOffset < 0) {
            throw new IllegalArgumentException("Waterfall offset must be a non-negative fraction, got " + waterfallOffset);
        }
    }

    // Bunch ranges may select a single id, ROI bounds must enclose an interval
    private static void requireRange(String name, double[] range, boolean allowSingleValue) {
        if (range == null) return;
        if (range.length != 2 || !Double.isFinite(range[0]) || !Double.isFinite(range[1])) {
            throw new IllegalArgumentException("'" + name + "' needs two finite values.");
        }
        if (range[0] > range[1] || (range[0] == range[1] && !allowSingleValue)) {
            throw new IllegalArgumentException(String.format("'%s' bounds are inverted or empty: [%s, %s]",
                    name, range[0], range[1]));
        }
    }

    /** Time step used for binning; the microbunch ordinate always bins single ids. */
    public double effectiveTimeStep() {
        return ordinate == Ordinate.MICROBUNCH ? 1.0 : timeStep;
    }

    public boolean hasCuts() {
        return !cutPositions.isBlank();
    }

    public Path runDirectoryPath() { return Path.of(runDirectory == null ? "." : runDirectory); }
    public Path cacheDirectoryPath() { return Path.of(cacheDirectory == null ? "cache" : cacheDirectory); }
    public Path outputDirectoryPath() { return Path.of(outputDirectory == null ? "." : outputDirectory); }
}
