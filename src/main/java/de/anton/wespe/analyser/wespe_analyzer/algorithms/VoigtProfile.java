package de.anton.wespe.analyser.wespe_analyzer.algorithms;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.util.FastMath;

/**
 * Area-normalized Voigt line shape, the convolution of a Gaussian (sigma) and a Lorentzian (gamma).
 * The Faddeeva function is evaluated with Humlicek's four-region rational approximation
 * (relative accuracy around 1e-4).
 */
public final class VoigtProfile {

    private static final double SQRT_2 = FastMath.sqrt(2.0);
    private static final double SQRT_2PI = FastMath.sqrt(2.0 * FastMath.PI);

    private VoigtProfile() {
        throw new IllegalStateException("Utility class");
    }

    /**
     * @param amplitude area under the peak
     * @param sigma     Gaussian width, positive
     * @param gamma     Lorentzian half width, non-negative
     */
    public static double value(double x, double amplitude, double center, double sigma, double gamma) {
        double scale = sigma * SQRT_2;
        Complex w = faddeeva((x - center) / scale, Math.abs(gamma) / scale);
        return amplitude * w.getReal() / (sigma * SQRT_2PI);
    }

    /** Full width at half maximum (Olivero-Longbothum approximation). */
    public static double fwhm(double sigma, double gamma) {
        return 1.0692 * gamma + FastMath.sqrt(0.8664 * gamma * gamma + 5.545083 * sigma * sigma);
    }

    /** w(x + iy) for y >= 0. */
    static Complex faddeeva(double x, double y) {
        Complex t = new Complex(y, -x);
        double s = Math.abs(x) + y;
        if (s >= 15.0) {
            Complex u = t.multiply(t);
            return t.multiply(0.5641896).divide(u.add(0.5));
        }
        if (s >= 5.5) {
            Complex u = t.multiply(t);
            return t.multiply(u.multiply(0.5641896).add(1.410474))
                    .divide(u.multiply(u.add(3.0)).add(0.75));
        }
        if (y >= 0.195 * Math.abs(x) - 0.176) {
            return horner(t, 0.5642236, 3.778987, 11.96482, 20.20933, 16.4955)
                    .divide(horner(t, 1.0, 6.699398, 21.69274, 39.27121, 38.82363, 16.4955));
        }
        Complex u = t.multiply(t);
        Complex numerator = horner(u, 0.56419, -1.320522, 35.76683, -219.0313, 1540.787, -3321.9905, 36183.31);
        Complex denominator = horner(u, -1.0, 1.841439, -61.57037, 364.2191, -2186.181, 9022.228, -24322.84, 32066.6);
        return u.exp().subtract(t.multiply(numerator).divide(denominator));
    }

    // Polynomial with real coefficients, highest degree first
    private static Complex horner(Complex z, double... coefficients) {
        Complex result = new Complex(coefficients[0]);
        for (int i = 1; i < coefficients.length; i++) {
            result = result.multiply(z).add(coefficients[i]);
        }
        return result;
    }
}
