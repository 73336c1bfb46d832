package de.anton.wespe.analyser.wespe_analyzer.model;

import de.anton.wespe.analyser.wespe_analyzer.algorithms.LevenbergMarquardtPeakSolver;
import de.anton.wespe.analyser.wespe_analyzer.algorithms.SolverResult;
import de.anton.wespe.analyser.wespe_analyzer.algorithms.VoigtPeakFunction;
import de.anton.wespe.analyser.wespe_analyzer.algorithms.VoigtProfile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PeakFitterTest {

    /** Time cut whose first sequence is a Voigt peak over the energy axis 0..10 eV. */
    private static MapCut peakCut(double amplitude, double center, double sigma, double gamma, double background) {
        int n = 101;
        double[] energy = new double[n];
        double[][] values = new double[1][n];
        for (int j = 0; j < n; j++) {
            energy[j] = BinningUtils.coordinate(0.0, j, 0.1);
            values[0][j] = VoigtProfile.value(energy[j], amplitude, center, sigma, gamma) + background;
        }
        DelayEnergyMap map = DelayEnergyMap.of(values, energy, new double[]{0.0}, Ordinate.DELAY,
                0.1, 0.1, 100.0, "peak");
        return MapCutExtractor.extract(map, List.of(0.0), List.of(0.5), MapAxis.TIME, Aggregation.MEAN);
    }

    @Test
    void startPointAndBoundsFollowTheData() {
        PeakFitter fitter = new PeakFitter((model, x, y, start, lower, upper) -> SolverResult.failure("unused"));
        double[] x = {0.0, 0.5, 1.0, 1.5, 2.0};
        double[] y = {1.0, 2.0, 9.0, 3.0, 1.0};

        PeakFitter.FitSetup setup = fitter.prepare(x, y);

        assertEquals(4.5, setup.start()[VoigtPeakFunction.AMPLITUDE]);
        assertEquals(1.0, setup.start()[VoigtPeakFunction.CENTER]);
        assertEquals(1.0, setup.start()[VoigtPeakFunction.SIGMA], 1e-12);
        assertEquals(2.0, setup.start()[VoigtPeakFunction.BACKGROUND]);
        assertEquals(0.45, setup.lower()[VoigtPeakFunction.AMPLITUDE], 1e-12);
        assertEquals(450.0, setup.upper()[VoigtPeakFunction.AMPLITUDE], 1e-9);
        assertEquals(0.0, setup.lower()[VoigtPeakFunction.CENTER]);
        assertEquals(2.0, setup.upper()[VoigtPeakFunction.CENTER]);
        assertEquals(1.0, setup.lower()[VoigtPeakFunction.BACKGROUND]);
        assertEquals(9.0, setup.upper()[VoigtPeakFunction.BACKGROUND]);
    }

    @Test
    void symmetricDataLeavesBackgroundUnbounded() {
        PeakFitter fitter = new PeakFitter((model, x, y, start, lower, upper) -> SolverResult.failure("unused"));

        PeakFitter.FitSetup setup = fitter.prepare(new double[]{0, 1, 2}, new double[]{-1, 1, 0});

        assertEquals(Double.NEGATIVE_INFINITY, setup.lower()[VoigtPeakFunction.BACKGROUND]);
        assertEquals(Double.POSITIVE_INFINITY, setup.upper()[VoigtPeakFunction.BACKGROUND]);
    }

    @Test
    void successfulFitIsRoundedAndAttached() {
        double[] solved = {10.0, 5.004, 0.3, 0.0, 1.0};
        PeakFitter fitter = new PeakFitter((model, x, y, start, lower, upper) ->
                new SolverResult(true, solved, 7, 0.01, "Converged"));
        MapCut cut = peakCut(10.0, 5.0, 0.3, 0.0, 1.0);

        PeakFitResult result = fitter.fit(cut);

        assertTrue(result.isConverged());
        assertEquals(5.0, result.getCenter());
        assertEquals(0.71, result.getFwhm());
        assertTrue(cut.hasFit());
        assertSame(result, cut.getFit());
        assertEquals("Fit: E = 5.0 eV, FWHM = 0.71 eV", result.toLabel(cut.getCoordinateVariableName(), cut.getCoordinateUnits()));
        assertEquals(result.getXFit().length, result.getYFit().length);
        assertEquals(0.0, result.getXFit()[0]);
        assertTrue(result.getXFit()[result.getXFit().length - 1] < 10.0);
    }

    @Test
    void failedFitLeavesCutWithoutFit() {
        PeakFitter fitter = new PeakFitter((model, x, y, start, lower, upper) -> SolverResult.failure("No convergence"));
        MapCut cut = peakCut(10.0, 5.0, 0.3, 0.0, 1.0);

        PeakFitResult result = fitter.fit(cut);

        assertFalse(result.isConverged());
        assertEquals("No convergence", result.getMessage());
        assertFalse(cut.hasFit());
    }

    @Test
    void levenbergMarquardtRecoversPeakPosition() {
        PeakFitter fitter = new PeakFitter(new LevenbergMarquardtPeakSolver());
        MapCut cut = peakCut(10.0, 5.3, 0.3, 0.2, 1.0);

        PeakFitResult result = fitter.fit(cut);

        assertTrue(result.isConverged(), result.getMessage());
        assertEquals(5.3, result.getCenter(), 0.05);
        assertEquals(VoigtProfile.fwhm(0.3, 0.2), result.getFwhm(), 0.2);
    }

    @Test
    void tooShortDataIsRejected() {
        PeakFitter fitter = new PeakFitter(new LevenbergMarquardtPeakSolver());
        assertThrows(IllegalArgumentException.class, () -> fitter.prepare(new double[]{1}, new double[]{1}));
        assertThrows(IllegalArgumentException.class,
                () -> fitter.prepare(new double[]{1, 2}, new double[]{Double.NaN, Double.NaN}));
    }
}
