package de.anton.wespe.analyser.wespe_analyzer.algorithms;

/**
 * Outcome of a {@link PeakSolver} run.
 *
 * @param parameters fitted parameters, empty when not converged
 * @param rms        root mean square of the residuals, NaN when not converged
 */
public record SolverResult(boolean converged, double[] parameters, int iterations, double rms, String message) {

    public static SolverResult failure(String message) {
        return new SolverResult(false, new double[0], 0, Double.NaN, message);
    }
}
