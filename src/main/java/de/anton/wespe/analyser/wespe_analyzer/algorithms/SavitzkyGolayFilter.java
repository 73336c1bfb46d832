package de.anton.wespe.analyser.wespe_analyzer.algorithms;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Savitzky-Golay smoothing: every point is replaced by the value at its position of the least-squares
 * polynomial fitted through the surrounding window. Values beyond both ends repeat the edge value.
 */
public class SavitzkyGolayFilter {

    private static final Logger logger = LoggerFactory.getLogger(SavitzkyGolayFilter.class);

    private final int windowLength;
    private final int polynomialOrder;
    private final double[] coefficients;

    /**
     * @param windowLength    odd, positive number of points in the window
     * @param polynomialOrder order of the local polynomial, below the window length
     */
    public SavitzkyGolayFilter(int windowLength, int polynomialOrder) {
        validate(windowLength, polynomialOrder);
        this.windowLength = windowLength;
        this.polynomialOrder = polynomialOrder;
        this.coefficients = computeCoefficients(windowLength, polynomialOrder);
        logger.debug("Savitzky-Golay filter created: window={}, order={}", windowLength, polynomialOrder);
    }

    /** Throws {@link IllegalArgumentException} for an even or non-positive window or an order outside [0, window). */
    public static void validate(int windowLength, int polynomialOrder) {
        if (windowLength <= 0 || windowLength % 2 == 0) {
            throw new IllegalArgumentException("Window length must be a positive odd number, got " + windowLength);
        }
        if (polynomialOrder < 0 || polynomialOrder >= windowLength) {
            throw new IllegalArgumentException(String.format(
                    "Polynomial order must be in [0, %d), got %d", windowLength, polynomialOrder));
        }
    }

    // First row of the pseudo-inverse of the Vandermonde matrix over -m..m
    private static double[] computeCoefficients(int windowLength, int order) {
        int half = windowLength / 2;
        RealMatrix vandermonde = new Array2DRowRealMatrix(windowLength, order + 1);
        for (int i = 0; i < windowLength; i++) {
            double position = i - half;
            for (int k = 0; k <= order; k++) {
                vandermonde.setEntry(i, k, Math.pow(position, k));
            }
        }
        RealMatrix pseudoInverse = new QRDecomposition(vandermonde).getSolver().getInverse();
        return pseudoInverse.getRow(0);
    }

    /** Returns the smoothed copy of {@code values}. */
    public double[] smooth(double[] values) {
        int n = values.length;
        int half = windowLength / 2;
        double[] result = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = 0.0;
            for (int k = -half; k <= half; k++) {
                int index = Math.min(n - 1, Math.max(0, i + k));
                sum += coefficients[k + half] * values[index];
            }
            result[i] = sum;
        }
        return result;
    }

    /** Applies {@link #smooth(double[])} {@code cycles} times, each pass on the previous output. */
    public double[] smooth(double[] values, int cycles) {
        if (cycles < 1) {
            throw new IllegalArgumentException("Smoothing cycles must be at least 1, got " + cycles);
        }
        double[] result = values;
        for (int c = 0; c < cycles; c++) {
            result = smooth(result);
        }
        return result;
    }

    public int getWindowLength() { return windowLength; }
    public int getPolynomialOrder() { return polynomialOrder; }
    double[] getCoefficients() { return coefficients.clone(); }
}
