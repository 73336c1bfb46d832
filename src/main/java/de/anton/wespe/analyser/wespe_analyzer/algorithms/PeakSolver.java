package de.anton.wespe.analyser.wespe_analyzer.algorithms;

import org.apache.commons.math3.analysis.ParametricUnivariateFunction;

/**
 * Bounded nonlinear least-squares fit of a parametric curve to sampled data.
 */
public interface PeakSolver {

    /**
     * @param model curve to fit
     * @param x     sample positions
     * @param y     sample values
     * @param start initial parameters, within the bounds
     * @param lower lower parameter bounds
     * @param upper upper parameter bounds
     * @return the fitted parameters, or a result with {@code converged == false} if the solver gave up
     */
    SolverResult solve(ParametricUnivariateFunction model, double[] x, double[] y,
                       double[] start, double[] lower, double[] upper);
}
