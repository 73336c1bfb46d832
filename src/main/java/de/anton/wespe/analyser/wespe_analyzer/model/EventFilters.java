package de.anton.wespe.analyser.wespe_analyzer.model;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Event-level filters applied to a run before its map is built.
 * Both filters shrink the run's {@link EventSet} in place; the run's {@link RunMetadata} is not recomputed.
 */
public final class EventFilters {

    private static final Logger logger = LoggerFactory.getLogger(EventFilters.class);
    private static final double OUTLIER_SIGMA = 3.0;

    private EventFilters() {
        throw new IllegalStateException("Utility class");
    }

    /**
     * Removes every event whose energy or time lies more than 3 standard deviations from that
     * channel's mean. Mean and (population) standard deviation of both channels are computed once
     * on the incoming set, the filter is not iterated.
     *
     * @return number of removed events
     */
    public static int removeOutliers(EventSet events, String runId) {
        if (events.isEmpty()) {
            logger.debug("Run {}: no events, outlier filter skipped.", runId);
            return 0;
        }
        double[] energy = events.getEnergy();
        double[] time = events.getTime();
        StandardDeviation populationStd = new StandardDeviation(false);
        Mean mean = new Mean();
        double energyMean = mean.evaluate(energy), energyStd = populationStd.evaluate(energy);
        double timeMean = mean.evaluate(time), timeStd = populationStd.evaluate(time);
        logger.debug("Run {}: energy mean={} std={}, time mean={} std={}", runId, energyMean, energyStd, timeMean, timeStd);

        int removed = events.removeWhere(i ->
                isOutlier(energy[i], energyMean, energyStd) || isOutlier(time[i], timeMean, timeStd));
        logger.info("Run {}: {} electrons removed as energy/time outliers.", runId, removed);
        return removed;
    }

    private static boolean isOutlier(double value, double mean, double std) {
        return value < mean - OUTLIER_SIGMA * std || value > mean + OUTLIER_SIGMA * std;
    }

    /**
     * Drops every event whose bunch id lies outside the inclusive range.
     * For {@link BunchType#MACRO} the range is in percent of the macrobunch id span observed at load time,
     * for {@link BunchType#MICRO} it is in absolute microbunch ids.
     *
     * @param range at least one value; its minimum and maximum define the range
     * @return number of removed events
     */
    public static int applyBunchFilter(Run run, double[] range, BunchType type) {
        if (range == null || range.length == 0) {
            throw new IllegalArgumentException("Bunch filter range must contain at least one value.");
        }
        for (double v : range) {
            if (Double.isNaN(v) || Double.isInfinite(v)) {
                throw new IllegalArgumentException("Bunch filter range must be numeric: " + Arrays.toString(range));
            }
        }
        double low = Arrays.stream(range).min().getAsDouble();
        double high = Arrays.stream(range).max().getAsDouble();

        EventSet events = run.getEvents();
        double bunchMin;
        double bunchMax;
        int removed;
        if (type == BunchType.MACRO) {
            RunMetadata metadata = run.getMetadata();
            double span = metadata.getMacrobunchMax() - metadata.getMacrobunchMin();
            bunchMin = metadata.getMacrobunchMin() + span * low / 100.0;
            bunchMax = metadata.getMacrobunchMin() + span * high / 100.0;
            final double min = bunchMin, max = bunchMax;
            removed = events.removeWhere(i -> events.macrobunchAt(i) < min || events.macrobunchAt(i) > max);
        } else {
            bunchMin = low;
            bunchMax = high;
            removed = events.removeWhere(i -> events.microbunchAt(i) < low || events.microbunchAt(i) > high);
        }
        run.setFilterLabel(type, type.rangeLabel(bunchMin, bunchMax));
        logger.info("Result of {} filtering ({}): {} electrons removed from Run {}",
                type, run.getFilterLabel(type), removed, run.getRunId());
        return removed;
    }
}
