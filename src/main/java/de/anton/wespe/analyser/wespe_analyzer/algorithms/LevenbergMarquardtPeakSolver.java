package de.anton.wespe.analyser.wespe_analyzer.algorithms;

import org.apache.commons.math3.analysis.ParametricUnivariateFunction;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * {@link PeakSolver} backed by the commons-math Levenberg-Marquardt optimizer.
 * Bounds are enforced by clamping every trial point into the box.
 */
public class LevenbergMarquardtPeakSolver implements PeakSolver {

    private static final Logger logger = LoggerFactory.getLogger(LevenbergMarquardtPeakSolver.class);

    private final int maxEvaluations;
    private final int maxIterations;

    public LevenbergMarquardtPeakSolver() {
        this(20000, 2000);
    }

    public LevenbergMarquardtPeakSolver(int maxEvaluations, int maxIterations) {
        if (maxEvaluations <= 0 || maxIterations <= 0) {
            throw new IllegalArgumentException("Evaluation and iteration limits must be positive.");
        }
        this.maxEvaluations = maxEvaluations;
        this.maxIterations = maxIterations;
    }

    @Override
    public SolverResult solve(ParametricUnivariateFunction model, double[] x, double[] y,
                              double[] start, double[] lower, double[] upper) {
        if (x.length != y.length || x.length == 0) {
            throw new IllegalArgumentException("Fit needs equally long, non-empty x and y arrays.");
        }
        if (start.length != lower.length || start.length != upper.length) {
            throw new IllegalArgumentException("Start point and bounds must have the same dimension.");
        }

        MultivariateJacobianFunction jacobianFunction = point -> {
            double[] p = point.toArray();
            RealVector values = new ArrayRealVector(x.length);
            RealMatrix jacobian = new Array2DRowRealMatrix(x.length, p.length);
            for (int i = 0; i < x.length; i++) {
                values.setEntry(i, model.value(x[i], p));
                jacobian.setRow(i, model.gradient(x[i], p));
            }
            return new Pair<>(values, jacobian);
        };
        ParameterValidator clampToBounds = point -> {
            RealVector clamped = point.copy();
            for (int k = 0; k < clamped.getDimension(); k++) {
                clamped.setEntry(k, Math.min(upper[k], Math.max(lower[k], clamped.getEntry(k))));
            }
            return clamped;
        };

        LeastSquaresProblem problem = new LeastSquaresBuilder()
                .start(start)
                .model(jacobianFunction)
                .target(y)
                .parameterValidator(clampToBounds)
                .lazyEvaluation(false)
                .maxEvaluations(maxEvaluations)
                .maxIterations(maxIterations)
                .build();

        try {
            LeastSquaresOptimizer.Optimum optimum = new LevenbergMarquardtOptimizer().optimize(problem);
            double[] fitted = clampToBounds.validate(optimum.getPoint()).toArray();
            logger.debug("Levenberg-Marquardt converged after {} iterations / {} evaluations, rms={}, parameters={}",
                    optimum.getIterations(), optimum.getEvaluations(), optimum.getRMS(), Arrays.toString(fitted));
            return new SolverResult(true, fitted, optimum.getIterations(), optimum.getRMS(), "Converged");
        } catch (TooManyEvaluationsException | TooManyIterationsException e) {
            logger.warn("Levenberg-Marquardt stopped without convergence: {}", e.getMessage());
            return SolverResult.failure("No convergence: " + e.getMessage());
        } catch (ConvergenceException e) {
            logger.warn("Levenberg-Marquardt failed to converge: {}", e.getMessage());
            return SolverResult.failure("Convergence failure: " + e.getMessage());
        }
    }
}
