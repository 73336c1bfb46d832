package de.anton.wespe.analyser.wespe_analyzer.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchTest {

    private static Run run(String id, int kineticEnergy, double mono, boolean staticScan) {
        EventSet events = RunTestUtils.eventsWithMono(new double[]{10, 11}, new double[]{1.0, 3.0}, mono);
        return RunTestUtils.run(id, events, kineticEnergy, staticScan);
    }

    @Test
    void runListIsSortedNumerically() {
        Batch batch = new Batch(List.of(run("12", 20, 100, false), run("3", 20, 100, false), run("7", 20, 100, false)));

        assertEquals("Uploaded runs: 3, 7, 12", batch.getRunListText());
        assertEquals("3, 7, 12", batch.getLoadedRunsLabel());
        assertEquals("12, 3, 7", batch.getRunIds());
    }

    @Test
    void singleAndLongRunLists() {
        assertEquals("Uploaded run: 5", new Batch(List.of(run("5", 20, 100, false))).getRunListText());

        List<Run> runs = new ArrayList<>();
        for (int id = 7; id >= 1; id--) runs.add(run(String.valueOf(id), 20, 100, false));
        Batch batch = new Batch(runs);
        assertEquals("Uploaded runs: 1-7", batch.getRunListText());
        assertEquals("1-7", batch.getLoadedRunsLabel());
    }

    @Test
    void consistencyChecksOfHomogeneousBatch() {
        Batch batch = new Batch(List.of(run("1", 20, 100.0, false), run("2", 24, 100.1, false)));

        assertEquals("Static check: All runs are delay scans (+)", batch.staticCheck());
        assertEquals("Region check: Homogeneous energy regions (+)", batch.regionCheck());
        assertEquals("Mono check: No mono energy jumps detected (+)", batch.monoCheck());
        assertFalse(batch.hasStaticRuns());
    }

    @Test
    void consistencyChecksOfMixedBatch() {
        Batch batch = new Batch(List.of(run("1", 20, 100.0, true), run("2", 30, 100.2, false)));

        assertEquals("Static check: Delay scans are mixed with static scans (!!!)", batch.staticCheck());
        assertEquals("Region check: Various energy regions are on the list (!!!)", batch.regionCheck());
        assertEquals("Mono check: Various mono values for different runs (!!!)", batch.monoCheck());
        assertEquals("Static check: All runs are static (+)",
                new Batch(List.of(run("1", 20, 100.0, true))).staticCheck());
    }

    @Test
    void summaryTexts() {
        Batch batch = new Batch(List.of(run("41", 20, 100.0, false)));

        assertEquals("SHORT SUMMARY:\n\nUploaded run: 41\nStatic check: All runs are delay scans (+)\n"
                + "Region check: Homogeneous energy regions (+)\nMono check: No mono energy jumps detected (+)\n\n",
                batch.shortSummary());
        assertTrue(batch.detailedInfo().startsWith("DETAILED INFO:\n\nFile name: 41 / Electrons detected: 2"));
    }

    @Test
    void energyThresholdFollowsHighestMono() {
        assertEquals(150.2, new Batch(List.of(run("1", 20, 100.0, false), run("2", 20, 100.2, false))).energyThreshold(), 1e-9);
        assertEquals(1000.0, new Batch(List.of(run("1", 20, -10.0, false))).energyThreshold());
    }

    @Test
    void staticCutPositionsAreMeanTimesOfStaticRuns() {
        Batch batch = new Batch(List.of(run("1", 20, 100.0, false), run("2", 20, 100.0, true)));
        assertEquals(List.of(2.0), batch.staticCutPositions());
    }

    @Test
    void emptyBatchIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Batch(List.of()));
    }
}
