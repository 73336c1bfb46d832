package de.anton.wespe.analyser.wespe_analyzer.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Counts the electrons of one run into a {@link DelayEnergyMap}.
 * <p>
 * Energies and times are first rounded with {@link BinningUtils#roundToStep(double, double)}; the bin of a
 * rounded value is then found with {@link BinningUtils#binIndex(double, double, double)} relative to the
 * smallest rounded value. Both {@link CountingAlgorithm}s use this index, so they never lose counts
 * to floating point comparison.
 */
public final class DelayEnergyMapBuilder {

    private static final Logger logger = LoggerFactory.getLogger(DelayEnergyMapBuilder.class);

    private DelayEnergyMapBuilder() {
        throw new IllegalStateException("Utility class");
    }

    /**
     * Builds the map of a filtered run.
     *
     * @param energyStep energy bin width in eV
     * @param timeStep   time bin width in the ordinate's units
     * @throws IllegalArgumentException if a step is invalid or the run has no events left
     */
    public static DelayEnergyMap build(Run run, double energyStep, double timeStep,
                                       Ordinate ordinate, CountingAlgorithm algorithm) {
        Objects.requireNonNull(run, "Run cannot be null");
        Objects.requireNonNull(ordinate, "Ordinate cannot be null");
        Objects.requireNonNull(algorithm, "Counting algorithm cannot be null");
        BinningUtils.requireValidStep(energyStep);
        BinningUtils.requireValidStep(timeStep);
        EventSet events = run.getEvents();
        if (events.isEmpty()) {
            throw new IllegalArgumentException("Run " + run.getRunId() + " has no events left to build a map from.");
        }

        long startTime = System.nanoTime();
        double[] energy = BinningUtils.roundToStep(events.getEnergy(), energyStep);
        double[] time = BinningUtils.roundToStep(
                ordinate == Ordinate.DELAY ? events.getTime() : events.getMicrobunchId(), timeStep);

        double energyMin = ArrayStatistics.nanMin(energy);
        int energyBins = BinningUtils.binIndex(ArrayStatistics.nanMax(energy), energyMin, energyStep) + 1;
        double[] kinetic = new double[energyBins];
        for (int j = 0; j < energyBins; j++) {
            kinetic[j] = BinningUtils.coordinate(energyMin, j, energyStep);
        }

        double[][] counts;
        double[] timeCoordinates;
        if (algorithm == CountingAlgorithm.CLASSIC) {
            // Time key -> energy histogram, sorted ascending by key
            TreeMap<Double, double[]> rows = new TreeMap<>();
            for (int k = 0; k < energy.length; k++) {
                double[] row = rows.computeIfAbsent(time[k], key -> new double[energyBins]);
                row[BinningUtils.binIndex(energy[k], energyMin, energyStep)]++;
            }
            counts = new double[rows.size()][];
            timeCoordinates = new double[rows.size()];
            int i = 0;
            for (Map.Entry<Double, double[]> entry : rows.entrySet()) {
                timeCoordinates[i] = entry.getKey();
                counts[i] = entry.getValue();
                i++;
            }
        } else {
            double timeMin = ArrayStatistics.nanMin(time);
            int timeBins = BinningUtils.binIndex(ArrayStatistics.nanMax(time), timeMin, timeStep) + 1;
            counts = new double[timeBins][energyBins];
            timeCoordinates = new double[timeBins];
            for (int i = 0; i < timeBins; i++) {
                timeCoordinates[i] = BinningUtils.coordinate(timeMin, i, timeStep);
            }
            for (int k = 0; k < energy.length; k++) {
                counts[BinningUtils.binIndex(time[k], timeMin, timeStep)]
                        [BinningUtils.binIndex(energy[k], energyMin, energyStep)]++;
            }
        }

        DelayEnergyMap map = DelayEnergyMap.of(counts, kinetic, timeCoordinates, ordinate, energyStep, timeStep,
                run.getMetadata().getMonoMean(), "Run " + run.getRunId());
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime);
        logger.info("Run {} done: {} map with {} time rows x {} energy bins in {} ms.",
                run.getRunId(), algorithm, map.getTimeSize(), map.getEnergySize(), durationMs);
        return map;
    }
}
