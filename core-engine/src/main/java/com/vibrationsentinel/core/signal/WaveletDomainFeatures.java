package com.vibrationsentinel.core.signal;

import java.util.List;

/**
 * Energy, entropy and variance features from a four-level db4
 * decomposition of the raw window.
 */
final class WaveletDomainFeatures {

    static final int COUNT = 10;
    static final int LEVELS = 4;

    private static final double EPS = 1e-12;
    private static final double LN2 = Math.log(2.0);

    private WaveletDomainFeatures() {
        // utility class, not instantiable
    }

    /**
     * Writes detail energies D1..D4, the level-4 approximation energy,
     * detail Shannon entropies D1..D4 and the approximation variance into
     * {@code out} starting at {@code offset}.
     */
    static void compute(double[] x, double[] out, int offset) {
        DaubechiesWavelet.Decomposition dec = DaubechiesWavelet.decompose(x, LEVELS);
        List<double[]> details = dec.details();
        for (int level = 0; level < LEVELS; level++) {
            double[] d = details.get(level);
            out[offset + level] = energy(d);
            out[offset + LEVELS + 1 + level] = entropy(d);
        }
        double[] approx = dec.approximation();
        out[offset + LEVELS] = energy(approx);
        out[offset + 2 * LEVELS + 1] = variance(approx);
    }

    static double energy(double[] c) {
        double e = 0.0;
        for (double v : c) {
            e += v * v;
        }
        return e;
    }

    /** Shannon entropy in bits of the normalized squared coefficients. */
    static double entropy(double[] c) {
        double total = energy(c) + EPS;
        double h = 0.0;
        for (double v : c) {
            double p = v * v / total;
            if (p > 0.0) {
                h -= p * Math.log(p) / LN2;
            }
        }
        return h;
    }

    static double variance(double[] c) {
        double mean = 0.0;
        for (double v : c) {
            mean += v;
        }
        mean /= c.length;
        double var = 0.0;
        for (double v : c) {
            var += (v - mean) * (v - mean);
        }
        return var / c.length;
    }
}
