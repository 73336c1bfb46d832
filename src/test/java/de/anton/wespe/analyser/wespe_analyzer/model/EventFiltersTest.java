package de.anton.wespe.analyser.wespe_analyzer.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class EventFiltersTest {

    @Test
    void removesEnergyAndTimeOutliersInOnePass() {
        double[] energy = new double[22];
        double[] time = new double[22];
        Arrays.fill(energy, 10.0);
        energy[5] = 100.0;   // energy outlier
        time[17] = -500.0;   // time outlier
        EventSet events = RunTestUtils.events(energy, time);

        int removed = EventFilters.removeOutliers(events, "1");

        assertEquals(2, removed);
        assertEquals(20, events.size());
        assertTrue(Arrays.stream(events.getEnergy()).allMatch(e -> e == 10.0));
        assertTrue(Arrays.stream(events.getTime()).allMatch(t -> t == 0.0));
    }

    @Test
    void removalKeepsSequencesAligned() {
        double[] energy = new double[21];
        double[] time = new double[21];
        Arrays.fill(energy, 10.0);
        energy[3] = 100.0;
        EventSet events = RunTestUtils.events(energy, time);

        EventFilters.removeOutliers(events, "1");

        double[] macro = events.getMacrobunchId();
        assertEquals(20, macro.length);
        assertFalse(Arrays.stream(macro).anyMatch(id -> id == 3.0));
        assertEquals(events.size(), events.getMicrobunchId().length);
    }

    @Test
    void constantRunLosesNothing() {
        double[] energy = new double[10];
        Arrays.fill(energy, 5.0);
        EventSet events = RunTestUtils.events(energy, new double[10]);

        assertEquals(0, EventFilters.removeOutliers(events, "1"));
        assertEquals(10, events.size());
    }

    @Test
    void macroFilterUsesPercentOfLoadedSpan() {
        Run run = RunTestUtils.run("7", RunTestUtils.events(new double[10], new double[10]));

        int removed = EventFilters.applyBunchFilter(run, new double[]{0, 50}, BunchType.MACRO);

        assertEquals(5, removed);
        assertEquals("0-4_Macro_B", run.getMacroFilterLabel());
        assertEquals(BunchType.MICRO.unfilteredLabel(), run.getMicroFilterLabel());
        assertTrue(Arrays.stream(run.getEvents().getMacrobunchId()).allMatch(id -> id <= 4.5));
    }

    @Test
    void microFilterUsesAbsoluteIdsInEitherOrder() {
        Run run = RunTestUtils.run("7", RunTestUtils.events(new double[20], new double[20]));

        int removed = EventFilters.applyBunchFilter(run, new double[]{3, 2}, BunchType.MICRO);

        assertEquals(16, removed);
        assertEquals("2-3_Micro_B", run.getMicroFilterLabel());
        assertTrue(Arrays.stream(run.getEvents().getMicrobunchId()).allMatch(id -> id == 2 || id == 3));
    }

    @Test
    void emptyOrNonNumericRangeIsRejected() {
        Run run = RunTestUtils.run("7", RunTestUtils.events(new double[3], new double[3]));
        assertThrows(IllegalArgumentException.class,
                () -> EventFilters.applyBunchFilter(run, new double[0], BunchType.MICRO));
        assertThrows(IllegalArgumentException.class,
                () -> EventFilters.applyBunchFilter(run, new double[]{1, Double.NaN}, BunchType.MICRO));
    }
}
