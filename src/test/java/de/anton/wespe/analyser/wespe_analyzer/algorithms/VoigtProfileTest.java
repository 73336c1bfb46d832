package de.anton.wespe.analyser.wespe_analyzer.algorithms;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VoigtProfileTest {

    @Test
    void pureGaussianPeakHeight() {
        double sigma = 0.4;
        double peak = VoigtProfile.value(2.0, 3.0, 2.0, sigma, 0.0);
        assertEquals(3.0 / (sigma * Math.sqrt(2 * Math.PI)), peak, 1e-6);
        double oneSigma = VoigtProfile.value(2.0 + sigma, 3.0, 2.0, sigma, 0.0);
        assertEquals(peak * Math.exp(-0.5), oneSigma, peak * 1e-3);
    }

    @Test
    void profileIsSymmetric() {
        for (double dx : new double[]{0.1, 0.7, 2.5, 9.0}) {
            double left = VoigtProfile.value(-dx, 1.0, 0.0, 0.5, 0.3);
            double right = VoigtProfile.value(dx, 1.0, 0.0, 0.5, 0.3);
            assertEquals(left, right, 1e-12 + 1e-9 * Math.abs(left));
        }
    }

    @Test
    void areaEqualsAmplitude() {
        double area = 0.0;
        double dx = 0.01;
        for (double x = -200; x <= 200; x += dx) {
            area += VoigtProfile.value(x, 5.0, 0.0, 0.5, 0.5) * dx;
        }
        assertEquals(5.0, area, 0.05);
    }

    @Test
    void fwhmLimits() {
        assertEquals(2.35482, VoigtProfile.fwhm(1.0, 0.0), 1e-4);
        assertEquals(2.0, VoigtProfile.fwhm(0.0, 1.0), 1e-3);
    }

    @Test
    void peakFunctionAddsBackgroundAndHasUnitBackgroundGradient() {
        VoigtPeakFunction function = new VoigtPeakFunction();
        double[] p = {2.0, 1.0, 0.3, 0.1, 0.5};
        assertEquals(VoigtProfile.value(1.2, 2.0, 1.0, 0.3, 0.1) + 0.5, function.value(1.2, p), 1e-12);
        double[] gradient = function.gradient(1.2, p);
        assertEquals(VoigtPeakFunction.PARAMETER_COUNT, gradient.length);
        assertEquals(1.0, gradient[VoigtPeakFunction.BACKGROUND]);
        // value is linear in the amplitude
        assertEquals(VoigtProfile.value(1.2, 1.0, 1.0, 0.3, 0.1), gradient[VoigtPeakFunction.AMPLITUDE], 1e-6);
        assertThrows(IllegalArgumentException.class, () -> function.value(1.0, 1.0, 2.0));
    }
}
