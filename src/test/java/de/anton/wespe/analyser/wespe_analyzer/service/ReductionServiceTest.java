package de.anton.wespe.analyser.wespe_analyzer.service;

import de.anton.wespe.analyser.wespe_analyzer.algorithms.SolverResult;
import de.anton.wespe.analyser.wespe_analyzer.model.Batch;
import de.anton.wespe.analyser.wespe_analyzer.model.DelayEnergyMap;
import de.anton.wespe.analyser.wespe_analyzer.model.EnergyAxis;
import de.anton.wespe.analyser.wespe_analyzer.model.MapCache;
import de.anton.wespe.analyser.wespe_analyzer.model.MapType;
import de.anton.wespe.analyser.wespe_analyzer.model.PeakFitter;
import de.anton.wespe.analyser.wespe_analyzer.model.Run;
import de.anton.wespe.analyser.wespe_analyzer.model.RunTestUtils;
import de.anton.wespe.analyser.wespe_analyzer.model.TimeAxis;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ReductionServiceTest {

    private static final double[] ENERGIES = {10.0, 10.1, 10.2, 10.3, 10.4};
    private static final double[] TIMES = {-0.5, -0.4, -0.3, -0.2, -0.1, 0.0, 0.1, 0.2, 0.3, 0.4, 0.5};

    private final MemoryCache cache = new MemoryCache();
    private final ReductionService service = new ReductionService(
            new PeakFitter((model, x, y, start, lower, upper) ->
                    new SolverResult(true, new double[]{2.0, 10.2, 0.1, 0.1, 4.0}, 5, 0.0, "Converged")),
            cache);

    /** Map cache kept in memory, counting reads. */
    private static class MemoryCache implements MapCache {
        final Map<String, DelayEnergyMap> maps = new HashMap<>();
        int reads;

        @Override
        public Optional<DelayEnergyMap> read(String key) {
            reads++;
            return Optional.ofNullable(maps.get(key));
        }

        @Override
        public void write(String key, DelayEnergyMap map) {
            maps.put(key, map);
        }
    }

    private static ReductionConfiguration config(String overrides) throws IOException {
        String base = "\"energyStep\": 0.1, \"timeStep\": 0.1, \"removeOutliers\": false";
        return new ConfigurationLoader().fromJson("{" + base + (overrides.isEmpty() ? "" : ", " + overrides) + "}");
    }

    private static Batch delayBatch(int perCell) {
        return delayBatch(ENERGIES, perCell);
    }

    private static Batch delayBatch(double[] energies, int perCell) {
        return new Batch(List.of(
                RunTestUtils.run("1", RunTestUtils.grid(energies, TIMES, perCell, 100.0)),
                RunTestUtils.run("2", RunTestUtils.grid(energies, TIMES, perCell, 100.0))));
    }

    @Test
    void runsAreMergedIntoOneMap() throws IOException {
        Batch batch = delayBatch(2);

        ReductionService.ReductionResult result = service.reduce(batch, config(""));

        assertTrue(result.isMergeSuccessful());
        assertEquals(MapType.MAP, result.displayMap.getType());
        assertEquals(TIMES.length, result.displayMap.getTimeSize());
        assertEquals(ENERGIES.length, result.displayMap.getEnergySize());
        assertEquals(2 * 2 * ENERGIES.length * TIMES.length, result.displayMap.total(), 1e-9);
        assertSame(batch.getCombinedMap(), result.batch.getCombinedMap());
        assertTrue(batch.getRuns().stream().allMatch(Run::hasMap));
        assertNull(result.cut);
        assertNull(result.staticCut);
        assertNull(result.fit);
    }

    @Test
    void cutsAndPeakFitAreTakenFromTheDisplayMap() throws IOException {
        ReductionService.ReductionResult result = service.reduce(delayBatch(2),
                config("\"cutPositions\": \"0.0\", \"cutWidths\": [0.1], \"peakFit\": true"));

        assertNotNull(result.cut);
        assertEquals(1, result.cut.size());
        assertArrayEquals(new double[]{4, 4, 4, 4, 4}, result.cut.getCut(0), 1e-9);
        assertTrue(result.fit.isConverged());
        assertEquals(10.2, result.fit.getCenter());
        assertTrue(result.cut.hasFit());
    }

    @Test
    void differenceMapUsesTheRowsBeforeTimeZeroAsBaseline() throws IOException {
        Batch batch = delayBatch(2);

        ReductionService.ReductionResult result = service.reduce(batch,
                config("\"timeZero\": 0.2, \"differenceMap\": true, \"timeAxis\": \"DELAY_RELATIVE_T0\""));

        assertEquals(0.2, batch.getCombinedMap().getTimeZero());
        assertTrue(batch.hasDifferenceMap());
        assertEquals(MapType.DIFFERENCE, result.displayMap.getType());
        assertEquals(TimeAxis.DELAY_RELATIVE_T0, result.displayMap.getTimeAxis());
        assertEquals(0.7, result.displayMap.getTimeCoordinates()[0], 1e-9);
        for (double[] row : result.displayMap.getValues()) {
            for (double v : row) assertEquals(0.0, v, 1e-9);
        }
    }

    @Test
    void differenceMapWithoutBaselineRowsFails() throws IOException {
        ReductionConfiguration config = config("\"timeZero\": 1.0, \"differenceMap\": true");
        assertThrows(IllegalStateException.class, () -> service.reduce(delayBatch(2), config));
    }

    @Test
    void sparseRunsCannotBeMerged() throws IOException {
        Batch batch = new Batch(List.of(RunTestUtils.run("1",
                RunTestUtils.eventsWithMono(new double[]{10.0, 10.5}, new double[]{0.0, 0.0}, 100.0))));

        ReductionService.ReductionResult result = service.reduce(batch, config("\"cutPositions\": \"0.0\""));

        assertFalse(result.isMergeSuccessful());
        assertNull(result.cut);
        assertSame(result.displayMap, batch.getCombinedMap());
    }

    @Test
    void cachedMapsReplaceTheHistogram() throws IOException {
        ReductionConfiguration config = config("\"cacheEnabled\": true, \"macroBunchRange\": [0, 50]");

        service.reduce(delayBatch(2), config);
        assertEquals(2, cache.reads);
        assertTrue(cache.maps.containsKey("1_DLD4Q_0.1eV_0.1ps_0-54_Macro_B_All_Micro_B_raw"));
        assertTrue(cache.maps.containsKey("2_DLD4Q_0.1eV_0.1ps_0-54_Macro_B_All_Micro_B_raw"));

        // different energies, same keys: the first reduction's maps come back
        ReductionService.ReductionResult second = service.reduce(
                delayBatch(new double[]{11.0, 11.1, 11.2, 11.3, 11.4}, 2), config);
        assertEquals(4, cache.reads);
        assertEquals(10.0, second.displayMap.getEnergyCoordinates()[0], 1e-9);
        assertEquals(2 * 55, second.displayMap.total(), 1e-9);
    }

    @Test
    void microbunchMapsAreNotCached() throws IOException {
        ReductionService.ReductionResult result = service.reduce(delayBatch(2),
                config("\"cacheEnabled\": true, \"ordinate\": \"MICROBUNCH\""));

        assertTrue(result.isMergeSuccessful());
        assertEquals(TimeAxis.MICROBUNCH_ID, result.displayMap.getTimeAxis());
        assertEquals(0, cache.reads);
        assertTrue(cache.maps.isEmpty());
    }

    @Test
    void blankMonoReadingKeepsTheEnergyThreshold() throws IOException {
        Batch batch = new Batch(List.of(RunTestUtils.run("1",
                RunTestUtils.withBlankMono(RunTestUtils.grid(ENERGIES, TIMES, 2, 100.0), 0))));

        ReductionService.ReductionResult result = service.reduce(batch, config(""));

        assertEquals(150.0, batch.energyThreshold());
        assertTrue(result.isMergeSuccessful());
        assertEquals(ENERGIES.length, result.displayMap.getEnergySize());
        assertFalse(Double.isNaN(result.displayMap.getEnergyCoordinates(EnergyAxis.BINDING)[0]));
    }

    @Test
    void staticRunsGetANormalizedQuickCut() throws IOException {
        double[] energy = {10.0, 10.0, 10.1, 10.1, 10.1, 10.1};
        double[] time = {42, 42, 42, 42, 42, 42};
        Batch batch = new Batch(List.of(RunTestUtils.run("42", RunTestUtils.eventsWithMono(energy, time, 0.0), 20, true)));

        ReductionService.ReductionResult result = service.reduce(batch, config(""));

        assertNotNull(result.staticCut);
        assertArrayEquals(new double[]{0.0, 1.0}, result.staticCut.getCut(0), 1e-9);
        assertEquals(50.0, batch.energyThreshold());
    }
}
