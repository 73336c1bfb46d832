package de.anton.wespe.analyser.wespe_analyzer.service;

import de.anton.wespe.analyser.wespe_analyzer.algorithms.LevenbergMarquardtPeakSolver;
import de.anton.wespe.analyser.wespe_analyzer.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Service performing the reduction of a loaded batch: event filtering, map construction (through the
 * cache when enabled), merging, time zero, difference map, display transforms, cuts and the peak fit.
 * The service holds no state between calls; the runs of the batch are filtered in place, so every
 * batch is reduced once.
 */
public class ReductionService {

    private static final Logger logger = LoggerFactory.getLogger(ReductionService.class);
    static final double STATIC_CUT_WIDTH = 0.5;
    private static final String UNFILTERED_SUFFIX = "_raw";

    private final PeakFitter peakFitter;
    private final MapCache mapCache; // null when the configuration decides

    /**
     * Represents the result of a reduction.
     * Maps and cuts not requested by the configuration are null.
     */
    public static class ReductionResult {
        public final Batch batch;
        public final DelayEnergyMap displayMap;
        public final MapCut staticCut;
        public final MapCut cut;
        public final PeakFitResult fit;

        private ReductionResult(Batch batch, DelayEnergyMap displayMap, MapCut staticCut, MapCut cut, PeakFitResult fit) {
            this.batch = batch;
            this.displayMap = displayMap;
            this.staticCut = staticCut;
            this.cut = cut;
            this.fit = fit;
        }

        public boolean isMergeSuccessful() {
            return displayMap != null && displayMap.isMergeSuccessful();
        }
    }

    public ReductionService() {
        this(new PeakFitter(new LevenbergMarquardtPeakSolver()), null);
    }

    /**
     * @param mapCache cache to use; when null a {@link JsonFileMapCache} in the configured directory is used
     *                 if the configuration enables caching
     */
    public ReductionService(PeakFitter peakFitter, MapCache mapCache) {
        this.peakFitter = Objects.requireNonNull(peakFitter, "Peak fitter cannot be null.");
        this.mapCache = mapCache;
    }

    /**
     * Executes the complete reduction.
     *
     * @throws IllegalArgumentException for invalid numeric settings (ROI, cut widths, positions)
     * @throws IllegalStateException    for transforms the map does not support (e.g. a difference map without baseline)
     */
    public ReductionResult reduce(Batch batch, ReductionConfiguration config) {
        Objects.requireNonNull(batch, "Batch cannot be null.");
        Objects.requireNonNull(config, "Configuration cannot be null.");
        long start = System.nanoTime();
        logger.info("Service: Starting reduction of {} (ordinate {}, {} counting, steps {} eV / {} {}).",
                batch.getRunListText(), config.ordinate(), config.countingAlgorithm(), config.energyStep(),
                config.effectiveTimeStep(), config.ordinate().getUnits());

        // 1. Filters and per-run maps
        Optional<MapCache> cache = resolveCache(config);
        List<DelayEnergyMap> maps = new ArrayList<>();
        for (Run run : batch.getRuns()) {
            filterRun(run, config);
            DelayEnergyMap map = buildOrLoad(run, config, cache);
            run.setMap(map);
            maps.add(map);
        }

        // 2. Merge
        DelayEnergyMap combined = BatchMerger.merge(maps, "Runs " + batch.getLoadedRunsLabel());
        if (!combined.isMergeSuccessful()) {
            logger.warn("Service: Runs {} could not be merged into one map, reduction stops here.", batch.getRunIds());
            batch.setCombinedMap(combined);
            return new ReductionResult(batch, combined, null, null, null);
        }

        // 3. Time zero and difference map
        if (config.timeZero() != null) {
            combined = MapTransformer.applyTimeZero(combined, config.timeZero());
        }
        batch.setCombinedMap(combined);
        DelayEnergyMap working = combined;
        if (config.differenceMap()) {
            working = MapTransformer.differenceMap(combined);
            batch.setDifferenceMap(working);
        }

        // 4. Kinetic energy window up to the photon energy threshold
        working = MapTransformer.clip(working, 0.0, batch.energyThreshold(), MapAxis.ENERGY);

        // 5. Display transforms
        DelayEnergyMap display = applyDisplayTransforms(working, config);

        // 6. Cuts
        MapCut staticCut = batch.hasStaticRuns() ? staticQuickCut(display, batch.staticCutPositions()) : null;
        MapCut cut = null;
        PeakFitResult fit = null;
        if (config.hasCuts()) {
            cut = extractCuts(display, config);
            if (config.peakFit()) {
                fit = peakFitter.fit(cut);
            }
        }

        logger.info("Service: Reduction of {} completed in {} ms.", batch.getRunIds(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        return new ReductionResult(batch, display, staticCut, cut, fit);
    }

    private Optional<MapCache> resolveCache(ReductionConfiguration config) {
        if (!config.cacheEnabled()) {
            return Optional.empty();
        }
        return Optional.of(mapCache != null ? mapCache : new JsonFileMapCache(config.cacheDirectoryPath()));
    }

    /** Outlier removal and bunch filters, in that order. */
    void filterRun(Run run, ReductionConfiguration config) {
        if (config.removeOutliers()) {
            EventFilters.removeOutliers(run.getEvents(), run.getRunId());
        }
        if (config.macroBunchRange() != null) {
            EventFilters.applyBunchFilter(run, config.macroBunchRange(), BunchType.MACRO);
        }
        if (config.microBunchRange() != null) {
            EventFilters.applyBunchFilter(run, config.microBunchRange(), BunchType.MICRO);
        }
    }

    private DelayEnergyMap buildOrLoad(Run run, ReductionConfiguration config, Optional<MapCache> cache) {
        double timeStep = config.effectiveTimeStep();
        boolean cacheable = cache.isPresent() && config.ordinate() == Ordinate.DELAY;
        String key = MapCache.keyFor(run, config.energyStep(), timeStep)
                + (config.removeOutliers() ? "" : UNFILTERED_SUFFIX);
        if (cacheable) {
            Optional<DelayEnergyMap> cached = cache.get().read(key);
            if (cached.isPresent()) {
                return cached.get();
            }
        }
        DelayEnergyMap map = DelayEnergyMapBuilder.build(run, config.energyStep(), timeStep,
                config.ordinate(), config.countingAlgorithm());
        if (cacheable) {
            cache.get().write(key, map);
        }
        return map;
    }

    /** Axis labelings, normalization and the configured regions of interest. */
    DelayEnergyMap applyDisplayTransforms(DelayEnergyMap map, ReductionConfiguration config) {
        DelayEnergyMap result = MapTransformer.switchEnergyAxis(map, config.energyAxis());
        result = MapTransformer.switchTimeAxis(result, config.timeAxis());
        result = MapTransformer.normalize(result, config.mapNormalization());
        if (config.energyRoi() != null) {
            result = MapTransformer.clip(result, config.energyRoi(), MapAxis.ENERGY);
        }
        if (config.timeRoi() != null) {
            result = MapTransformer.clip(result, config.timeRoi(), MapAxis.TIME);
        }
        logger.info("Service: Display map {} x {} ({}, {}, normalization {}).", result.getTimeSize(),
                result.getEnergySize(), result.getEnergyAxis(), result.getTimeAxis(), config.mapNormalization());
        return result;
    }

    /**
     * Energy profiles of the static runs, taken on the raw time axis at their mean time.
     * Normalized to [0, 1] unless their mean is 0.
     */
    MapCut staticQuickCut(DelayEnergyMap display, List<Double> positions) {
        DelayEnergyMap raw = MapTransformer.switchTimeAxis(display, display.getOrdinate().getRawAxis());
        MapCut cut = MapCutExtractor.extract(raw, positions, Collections.singletonList(STATIC_CUT_WIDTH),
                MapAxis.TIME, Aggregation.MEAN);
        double sum = 0.0;
        int count = 0;
        for (double[] values : cut.getCuts()) {
            for (double v : values) {
                if (!Double.isNaN(v)) {
                    sum += v;
                    count++;
                }
            }
        }
        if (count > 0 && sum / count != 0.0) {
            MapCutProcessor.normalizeZeroOne(cut);
        }
        return cut;
    }

    /**
     * Extracts the configured cuts and post-processes them: normalization, smoothing, derivative,
     * inter-cut difference, waterfall.
     */
    public MapCut extractCuts(DelayEnergyMap map, ReductionConfiguration config) {
        List<Double> positions = MapCutExtractor.resolvePositions(config.cutPositions(), map, config.cutAxis());
        MapCut cut = MapCutExtractor.extract(map, positions, config.cutWidths(), config.cutAxis(), config.cutAggregation());
        MapCutProcessor.normalize(cut, config.cutNormalization());
        if (config.smoothing()) {
            MapCutProcessor.smooth(cut, config.smoothWindow(), config.smoothOrder(), config.smoothCycles());
        }
        if (config.derivative()) {
            MapCutProcessor.derivative(cut);
        }
        if (config.cutDifference() && cut.size() > 1) {
            MapCutProcessor.difference(cut, config.differenceMagnification());
        }
        if (config.waterfall()) {
            MapCutProcessor.waterfall(cut, config.waterfallOffset());
        }
        return cut;
    }
}
