package de.anton.wespe.analyser.wespe_analyzer.algorithms;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class SavitzkyGolayFilterTest {

    @Test
    void coefficientsSumToOne() {
        double sum = Arrays.stream(new SavitzkyGolayFilter(7, 3).getCoefficients()).sum();
        assertEquals(1.0, sum, 1e-12);
    }

    @Test
    void quadraticIsPreservedInsideTheWindow() {
        double[] values = new double[12];
        for (int i = 0; i < values.length; i++) values[i] = 0.5 * i * i - 2 * i + 3;

        double[] smoothed = new SavitzkyGolayFilter(5, 2).smooth(values);

        for (int i = 2; i < values.length - 2; i++) {
            assertEquals(values[i], smoothed[i], 1e-9, "index " + i);
        }
    }

    @Test
    void constantStaysConstantIncludingEdges() {
        double[] values = new double[6];
        Arrays.fill(values, 4.2);
        assertArrayEquals(values, new SavitzkyGolayFilter(5, 2).smooth(values, 3), 1e-12);
    }

    @Test
    void cyclesRepeatTheFilter() {
        SavitzkyGolayFilter filter = new SavitzkyGolayFilter(3, 1);
        double[] values = {0, 0, 9, 0, 0};
        assertArrayEquals(filter.smooth(filter.smooth(values)), filter.smooth(values, 2), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> filter.smooth(values, 0));
    }

    @Test
    void invalidWindowOrOrderIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SavitzkyGolayFilter(4, 1));
        assertThrows(IllegalArgumentException.class, () -> new SavitzkyGolayFilter(0, 0));
        assertThrows(IllegalArgumentException.class, () -> new SavitzkyGolayFilter(3, 3));
        assertThrows(IllegalArgumentException.class, () -> SavitzkyGolayFilter.validate(5, -1));
    }
}
