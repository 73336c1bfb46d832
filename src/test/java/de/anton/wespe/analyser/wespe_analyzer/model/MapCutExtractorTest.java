package de.anton.wespe.analyser.wespe_analyzer.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MapCutExtractorTest {

    private static final double EPS = 1e-12;

    private DelayEnergyMap map;

    @BeforeEach
    void setUp() {
        double[][] values = {{1, 2}, {3, 4}, {5, 6}, {7, 8}};
        map = RunTestUtils.map(values, new double[]{1.0, 1.1}, new double[]{0.0, 0.1, 0.2, 0.3});
    }

    @Test
    void missingWidthsRepeatTheLastOne() {
        assertEquals(List.of(0.5, 0.5, 0.5), MapCutExtractor.effectiveWidths(List.of(1.0, 2.0, 3.0), List.of(0.5)));
        assertEquals(List.of(0.3, 0.4, 0.4), MapCutExtractor.effectiveWidths(List.of(1.0, 2.0, 3.0), List.of(0.3, 0.4)));
        assertEquals(List.of(0.3), MapCutExtractor.effectiveWidths(List.of(1.0), List.of(0.3, 0.4)));
        assertEquals(List.of(MapCutExtractor.DEFAULT_WIDTH), MapCutExtractor.effectiveWidths(List.of(1.0), List.of()));
    }

    @Test
    void timeCutAveragesTheBand() {
        MapCut cut = MapCutExtractor.extract(map, List.of(0.15), List.of(0.1), MapAxis.TIME, Aggregation.MEAN);

        assertEquals(1, cut.size());
        assertTrue(cut.hasData(0));
        assertArrayEquals(new double[]{1.0, 1.1}, cut.getCoordinates());
        assertArrayEquals(new double[]{4, 5}, cut.getCut(0), EPS);
        assertEquals("T1 = 0.15 ps, dT1 = 0.1 ps", cut.getLabel(0));
        assertEquals("eV", cut.getCoordinateUnits());
    }

    @Test
    void sumAggregationAddsTheBand() {
        MapCut cut = MapCutExtractor.extract(map, List.of(0.15), List.of(0.1), MapAxis.TIME, Aggregation.SUM);
        assertArrayEquals(new double[]{8, 10}, cut.getCut(0), EPS);
    }

    @Test
    void energyCutRunsAlongTime() {
        MapCut cut = MapCutExtractor.extract(map, List.of(1.1), List.of(0.05), MapAxis.ENERGY, Aggregation.MEAN);

        assertArrayEquals(new double[]{0.0, 0.1, 0.2, 0.3}, cut.getCoordinates());
        assertArrayEquals(new double[]{2, 4, 6, 8}, cut.getCut(0), EPS);
        assertEquals("E", cut.getVariableName());
        assertEquals("T", cut.getCoordinateVariableName());
    }

    @Test
    void emptyBandIsFlaggedWithoutData() {
        MapCut cut = MapCutExtractor.extract(map, List.of(0.1, 5.0), List.of(0.1), MapAxis.TIME, Aggregation.MEAN);

        assertTrue(cut.hasData(0));
        assertFalse(cut.hasData(1));
        assertArrayEquals(new double[]{0, 0}, cut.getCut(1));
        assertEquals(List.of(0.1, 0.1), cut.getWidths());
    }

    @Test
    void invalidWidthsAndPositionsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> MapCutExtractor.extract(map, List.of(0.1), List.of(-0.1), MapAxis.TIME, Aggregation.MEAN));
        assertThrows(IllegalArgumentException.class,
                () -> MapCutExtractor.extract(map, List.of(), List.of(0.1), MapAxis.TIME, Aggregation.MEAN));
    }

    @Test
    void numericPositionsAreParsed() {
        assertEquals(List.of(0.1, 0.2), MapCutExtractor.resolvePositions("0.1, 0.2", map, MapAxis.TIME));
        assertThrows(IllegalArgumentException.class, () -> MapCutExtractor.resolvePositions(" ", map, MapAxis.TIME));
    }

    @Test
    void mainFeatureIsTheMaximumOfTheMedianProfile() {
        assertEquals(1.1, MapCutExtractor.locateFeature(map, "main", MapAxis.ENERGY), EPS);
        assertEquals(List.of(1.1), MapCutExtractor.resolvePositions("main", map, MapAxis.ENERGY));
        assertEquals(0.3, MapCutExtractor.locateFeature(map, "main", MapAxis.TIME), EPS);
    }

    @Test
    void sidebandAddsPhotonEnergy() {
        assertEquals(3.51, MapCutExtractor.locateFeature(map, "sb", MapAxis.ENERGY), EPS);
        assertEquals(2.6, MapCutExtractor.locateFeature(map, "sb, 1.5", MapAxis.ENERGY), EPS);
        assertEquals(List.of(2.6), MapCutExtractor.resolvePositions("SB,1.5", map, MapAxis.ENERGY));
    }

    @Test
    void numbersAreRoundedAndUnknownKeywordsRejected() {
        assertEquals(2.35, MapCutExtractor.locateFeature(map, "2.345", MapAxis.ENERGY), EPS);
        assertThrows(IllegalArgumentException.class, () -> MapCutExtractor.locateFeature(map, "peak", MapAxis.ENERGY));
    }
}
