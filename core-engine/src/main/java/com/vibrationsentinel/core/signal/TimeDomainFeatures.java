package com.vibrationsentinel.core.signal;

/**
 * Statistical features computed directly on the raw (untapered) window.
 *
 * <p>
 * Moments are population moments. Ratio features guard their denominators:
 * when RMS or mean absolute value is effectively zero, crest and impulse
 * factors are reported as the configured ceiling (or zero for an all-zero
 * window), and higher moments of a constant window are reported as zero.
 * </p>
 */
final class TimeDomainFeatures {

    static final int COUNT = 10;

    private static final double EPS = 1e-12;

    private TimeDomainFeatures() {
        // utility class, not instantiable
    }

    /**
     * Writes rms, peak, crest_factor, kurtosis, skewness, std_dev, energy,
     * mean_abs_value, peak_to_peak and impulse_factor into {@code out}
     * starting at {@code offset}.
     */
    static void compute(double[] x, double ceiling, double[] out, int offset) {
        int n = x.length;
        double sum = 0.0;
        double energy = 0.0;
        double absSum = 0.0;
        double peak = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : x) {
            sum += v;
            energy += v * v;
            absSum += Math.abs(v);
            peak = Math.max(peak, Math.abs(v));
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double mean = sum / n;
        double rms = Math.sqrt(energy / n);
        double meanAbs = absSum / n;

        double m2 = 0.0;
        double m3 = 0.0;
        double m4 = 0.0;
        for (double v : x) {
            double d = v - mean;
            double d2 = d * d;
            m2 += d2;
            m3 += d2 * d;
            m4 += d2 * d2;
        }
        m2 /= n;
        m3 /= n;
        m4 /= n;

        double skewness = m2 < EPS ? 0.0 : m3 / Math.pow(m2, 1.5);
        double kurtosis = m2 < EPS ? 0.0 : m4 / (m2 * m2) - 3.0;

        out[offset] = rms;
        out[offset + 1] = peak;
        out[offset + 2] = guardedRatio(peak, rms, ceiling);
        out[offset + 3] = kurtosis;
        out[offset + 4] = skewness;
        out[offset + 5] = Math.sqrt(m2);
        out[offset + 6] = energy;
        out[offset + 7] = meanAbs;
        out[offset + 8] = max - min;
        out[offset + 9] = guardedRatio(peak, meanAbs, ceiling);
    }

    static double guardedRatio(double numerator, double denominator, double ceiling) {
        if (denominator < EPS) {
            return numerator < EPS ? 0.0 : ceiling;
        }
        return Math.min(numerator / denominator, ceiling);
    }
}
