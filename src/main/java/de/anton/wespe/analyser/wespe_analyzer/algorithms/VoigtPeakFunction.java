package de.anton.wespe.analyser.wespe_analyzer.algorithms;

import org.apache.commons.math3.analysis.ParametricUnivariateFunction;

/**
 * Voigt peak on a constant background.
 * Parameter order: amplitude, center, sigma, gamma, background.
 */
public class VoigtPeakFunction implements ParametricUnivariateFunction {

    public static final int AMPLITUDE = 0;
    public static final int CENTER = 1;
    public static final int SIGMA = 2;
    public static final int GAMMA = 3;
    public static final int BACKGROUND = 4;
    public static final int PARAMETER_COUNT = 5;

    private static final double RELATIVE_STEP = 1e-6;

    @Override
    public double value(double x, double... p) {
        checkParameters(p);
        return VoigtProfile.value(x, p[AMPLITUDE], p[CENTER], p[SIGMA], p[GAMMA]) + p[BACKGROUND];
    }

    /** Central finite differences; the background derivative is exactly 1. */
    @Override
    public double[] gradient(double x, double... p) {
        checkParameters(p);
        double[] gradient = new double[PARAMETER_COUNT];
        double[] shifted = p.clone();
        for (int k = 0; k < BACKGROUND; k++) {
            double h = RELATIVE_STEP * Math.max(Math.abs(p[k]), 1e-3);
            shifted[k] = p[k] + h;
            double upper = value(x, shifted);
            shifted[k] = p[k] - h;
            double lower = value(x, shifted);
            shifted[k] = p[k];
            gradient[k] = (upper - lower) / (2 * h);
        }
        gradient[BACKGROUND] = 1.0;
        return gradient;
    }

    private static void checkParameters(double[] p) {
        if (p == null || p.length != PARAMETER_COUNT) {
            throw new IllegalArgumentException("Voigt peak needs " + PARAMETER_COUNT + " parameters.");
        }
    }
}
