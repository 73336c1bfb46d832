package de.anton.wespe.analyser.wespe_analyzer.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchMergerTest {

    @Test
    void identicalGridsAreSummedCellByCell() {
        DelayEnergyMap a = RunTestUtils.map(new double[][]{{5}}, new double[]{1.0}, new double[]{0.0});
        DelayEnergyMap b = RunTestUtils.map(new double[][]{{3}}, new double[]{1.0}, new double[]{0.0});

        DelayEnergyMap merged = BatchMerger.merge(List.of(a, b), "Runs 1, 2");

        assertTrue(merged.isMergeSuccessful());
        assertArrayEquals(new double[]{8}, merged.getRow(0));
        assertEquals("Runs 1, 2", merged.getName());
    }

    @Test
    void differingGridsAreMergedOnTheUnion() {
        DelayEnergyMap a = RunTestUtils.map(new double[][]{{2, 2}}, new double[]{1.0, 1.1}, new double[]{0.0});
        DelayEnergyMap b = RunTestUtils.map(new double[][]{{3, 3}}, new double[]{1.1, 1.2}, new double[]{0.1});

        DelayEnergyMap merged = BatchMerger.merge(List.of(a, b), "Runs");

        assertArrayEquals(new double[]{1.0, 1.1, 1.2}, merged.getEnergyCoordinates());
        assertArrayEquals(new double[]{0.0, 0.1}, merged.getTimeCoordinates());
        assertArrayEquals(new double[]{2, 2, 0}, merged.getRow(0));
        assertArrayEquals(new double[]{0, 3, 3}, merged.getRow(1));
        assertEquals(10.0, merged.total());
    }

    @Test
    void mergeIsCommutative() {
        DelayEnergyMap a = RunTestUtils.map(new double[][]{{4, 1}, {2, 6}}, new double[]{1.0, 1.1}, new double[]{0.0, 0.2});
        DelayEnergyMap b = RunTestUtils.map(new double[][]{{7, 3}}, new double[]{1.1, 1.2}, new double[]{0.2});

        DelayEnergyMap ab = BatchMerger.merge(List.of(a, b), "ab");
        DelayEnergyMap ba = BatchMerger.merge(List.of(b, a), "ba");

        assertArrayEquals(ab.getEnergyCoordinates(), ba.getEnergyCoordinates());
        assertArrayEquals(ab.getTimeCoordinates(), ba.getTimeCoordinates());
        for (int i = 0; i < ab.getTimeSize(); i++) {
            assertArrayEquals(ab.getRow(i), ba.getRow(i));
        }
    }

    @Test
    void sparseRowsAreDroppedAndIndexRenumbered() {
        DelayEnergyMap a = RunTestUtils.map(new double[][]{{1, 0}, {4, 4}, {0, 0}},
                new double[]{1.0, 1.1}, new double[]{0.0, 0.1, 0.2});

        DelayEnergyMap merged = BatchMerger.merge(List.of(a), "single");

        assertArrayEquals(new double[]{0.1}, merged.getTimeCoordinates());
        assertArrayEquals(new double[]{0.0}, merged.getTimeCoordinates(TimeAxis.DELAY_INDEX));
        assertArrayEquals(new double[]{4, 4}, merged.getRow(0));
    }

    @Test
    void mapWithoutUsableRowsIsFlaggedUnsuccessful() {
        DelayEnergyMap a = RunTestUtils.map(new double[][]{{1, 0}, {0, 1}},
                new double[]{1.0, 1.1}, new double[]{0.0, 0.1});

        DelayEnergyMap merged = BatchMerger.merge(List.of(a), "sparse");

        assertFalse(merged.isMergeSuccessful());
        assertTrue(merged.isDegenerate());
    }

    @Test
    void differentStepsCannotBeMerged() {
        DelayEnergyMap a = RunTestUtils.map(new double[][]{{5}}, new double[]{1.0}, new double[]{0.0});
        DelayEnergyMap b = DelayEnergyMap.of(new double[][]{{5}}, new double[]{1.0}, new double[]{0.0},
                Ordinate.DELAY, 0.05, 0.1, 100.0, "other");

        assertThrows(IllegalArgumentException.class, () -> BatchMerger.merge(List.of(a, b), "x"));
        assertThrows(IllegalArgumentException.class, () -> BatchMerger.merge(List.of(), "x"));
    }
}
