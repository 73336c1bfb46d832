package de.anton.wespe.analyser.wespe_analyzer.model;

import java.util.Locale;

/**
 * Outcome of a Voigt fit of the first sequence of a {@link MapCut}.
 * A failed fit carries the solver message and no curve.
 */
public final class PeakFitResult {

    private final boolean converged;
    private final double center;        // 2 decimals
    private final double fwhm;          // 2 decimals
    private final double[] parameters;  // amplitude, center, sigma, gamma, background
    private final double[] xFit;
    private final double[] yFit;
    private final String message;

    private PeakFitResult(boolean converged, double center, double fwhm, double[] parameters,
                          double[] xFit, double[] yFit, String message) {
        this.converged = converged;
        this.center = center;
        this.fwhm = fwhm;
        this.parameters = parameters;
        this.xFit = xFit;
        this.yFit = yFit;
        this.message = message;
    }

    static PeakFitResult success(double center, double fwhm, double[] parameters, double[] xFit, double[] yFit) {
        return new PeakFitResult(true, center, fwhm, parameters.clone(), xFit.clone(), yFit.clone(), "Converged");
    }

    static PeakFitResult failure(String message) {
        return new PeakFitResult(false, Double.NaN, Double.NaN, new double[0], new double[0], new double[0], message);
    }

    // --- Getters ---
    public boolean isConverged() { return converged; }
    public double getCenter() { return center; }
    public double getFwhm() { return fwhm; }
    public double[] getParameters() { return parameters.clone(); }
    public double[] getXFit() { return xFit.clone(); }
    public double[] getYFit() { return yFit.clone(); }
    public String getMessage() { return message; }

    /** Legend text such as {@code Fit: E = 12.3 eV, FWHM = 0.45 eV}. */
    public String toLabel(String variable, String units) {
        return String.format(Locale.ROOT, "Fit: %s = %s %s, FWHM = %s %s", variable, center, units, fwhm, units);
    }

    @Override
    public String toString() {
        return converged
                ? String.format(Locale.ROOT, "PeakFitResult[center=%s, fwhm=%s]", center, fwhm)
                : "PeakFitResult[failed: " + message + "]";
    }
}
