package de.anton.wespe.analyser.wespe_analyzer.model;

import de.anton.wespe.analyser.wespe_analyzer.algorithms.PeakSolver;
import de.anton.wespe.analyser.wespe_analyzer.algorithms.SolverResult;
import de.anton.wespe.analyser.wespe_analyzer.algorithms.VoigtPeakFunction;
import de.anton.wespe.analyser.wespe_analyzer.algorithms.VoigtProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fits a Voigt peak plus constant background to the first sequence of a cut, typically to find
 * time zero or the position of a line. The numerical work is done by an injected {@link PeakSolver}.
 */
public class PeakFitter {

    private static final Logger logger = LoggerFactory.getLogger(PeakFitter.class);
    private static final int RESAMPLING = 10;

    private final PeakSolver solver;
    private final VoigtPeakFunction model = new VoigtPeakFunction();

    public PeakFitter(PeakSolver solver) {
        this.solver = Objects.requireNonNull(solver, "Peak solver cannot be null");
    }

    /** Initial guess and bounds handed to the solver. */
    public record FitSetup(double[] start, double[] lower, double[] upper) {}

    /**
     * Derives the initial parameters and bounds from the data.
     * Widths start at twice the coordinate step and stay within 1 to 200 steps; the amplitude stays within
     * 0.1 to 100 times its guess (when the guess is not 0); the background stays within the data range
     * (unless that range is symmetric around 0).
     */
    public FitSetup prepare(double[] x, double[] y) {
        if (x.length != y.length || x.length < 2) {
            throw new IllegalArgumentException("A peak fit needs at least 2 points with matching coordinates.");
        }
        double step = Math.abs(meanStep(x));
        if (step == 0.0) {
            throw new IllegalArgumentException("Cut coordinates have zero spacing, cannot fit a peak.");
        }
        int peak = ArrayStatistics.nanArgMax(y);
        if (peak < 0) {
            throw new IllegalArgumentException("Cut holds no valid value to fit.");
        }
        double yMax = y[peak];
        double yMin = ArrayStatistics.nanMin(y);
        double amplitude = yMax / 2;
        double center = x[peak];
        double background = ArrayStatistics.median(y);

        double[] start = {amplitude, center, 2 * step, 2 * step, background};
        double[] lower = {Double.NEGATIVE_INFINITY, ArrayStatistics.nanMin(x), step, step, Double.NEGATIVE_INFINITY};
        double[] upper = {Double.POSITIVE_INFINITY, ArrayStatistics.nanMax(x), 200 * step, 200 * step, Double.POSITIVE_INFINITY};
        if (amplitude != 0.0) {
            lower[VoigtPeakFunction.AMPLITUDE] = Math.min(amplitude / 10, amplitude * 100);
            upper[VoigtPeakFunction.AMPLITUDE] = Math.max(amplitude / 10, amplitude * 100);
        }
        if (yMin + yMax != 0.0) {
            lower[VoigtPeakFunction.BACKGROUND] = yMin;
            upper[VoigtPeakFunction.BACKGROUND] = yMax;
        }
        return new FitSetup(start, lower, upper);
    }

    /**
     * Fits the first sequence of the cut. On success the result is also attached to the cut;
     * on failure the cut is left without a fit.
     */
    public PeakFitResult fit(MapCut cut) {
        double[] x = cut.getCoordinates();
        double[] y = cut.getCut(0);
        FitSetup setup = prepare(x, y);
        logger.debug("Voigt fit start={}, lower={}, upper={}", Arrays.toString(setup.start()),
                Arrays.toString(setup.lower()), Arrays.toString(setup.upper()));

        SolverResult solution = solver.solve(model, x, y, setup.start(), setup.lower(), setup.upper());
        if (!solution.converged()) {
            logger.warn("Voigt fit of '{}' failed: {}", cut.getMapName(), solution.message());
            return PeakFitResult.failure(solution.message());
        }
        double[] p = solution.parameters();
        double center = BinningUtils.roundToDecimals(p[VoigtPeakFunction.CENTER], 2);
        double fwhm = BinningUtils.roundToDecimals(
                VoigtProfile.fwhm(p[VoigtPeakFunction.SIGMA], p[VoigtPeakFunction.GAMMA]), 2);

        double[] xFit = resample(x);
        double[] yFit = new double[xFit.length];
        for (int i = 0; i < xFit.length; i++) {
            yFit[i] = model.value(xFit[i], p);
        }
        PeakFitResult result = PeakFitResult.success(center, fwhm, p, xFit, yFit);
        cut.setFit(result);
        logger.info("Voigt fit of '{}': center={} {}, FWHM={} {}", cut.getMapName(),
                center, cut.getCoordinateUnits(), fwhm, cut.getCoordinateUnits());
        return result;
    }

    private static double meanStep(double[] x) {
        double sum = 0.0;
        for (double g : ArrayStatistics.gradient(x)) sum += g;
        return sum / x.length;
    }

    /** From x[0] towards (excluding) x[last] in steps of a tenth of the first spacing. */
    static double[] resample(double[] x) {
        double step = (x[1] - x[0]) / RESAMPLING;
        if (step == 0.0) {
            return new double[0];
        }
        int count = (int) Math.ceil((x[x.length - 1] - x[0]) / step - 1e-9);
        double[] result = new double[Math.max(count, 0)];
        for (int i = 0; i < result.length; i++) {
            result[i] = x[0] + i * step;
        }
        return result;
    }
}
