package com.vibrationsentinel.core.signal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Multilevel discrete wavelet transform with the Daubechies-4 filter bank
 * and half-sample symmetric boundary extension.
 *
 * <p>
 * Each level convolves the current approximation with the decomposition
 * filters and keeps every second output, so a level with input length
 * {@code N} yields {@code floor((N + 7) / 2)} coefficients per band.
 * </p>
 */
final class DaubechiesWavelet {

    private static final double[] DEC_LO = {
            -0.010597401784997278, 0.032883011666982945, 0.030841381835986965, -0.18703481171888114,
            -0.02798376941698385, 0.6308807679295904, 0.7148465705525415, 0.23037781330885523
    };

    private static final double[] DEC_HI = {
            -0.23037781330885523, 0.7148465705525415, -0.6308807679295904, -0.02798376941698385,
            0.18703481171888114, 0.030841381835986965, -0.032883011666982945, -0.010597401784997278
    };

    private DaubechiesWavelet() {
        // utility class, not instantiable
    }

    /** Result of a multilevel decomposition. */
    static final class Decomposition {

        private final double[] approximation;
        private final List<double[]> details;

        private Decomposition(double[] approximation, List<double[]> details) {
            this.approximation = approximation;
            this.details = Collections.unmodifiableList(details);
        }

        /** Approximation coefficients at the deepest level. */
        double[] approximation() {
            return approximation;
        }

        /** Detail coefficients ordered from level 1 (finest) to the deepest level. */
        List<double[]> details() {
            return details;
        }
    }

    static Decomposition decompose(double[] signal, int levels) {
        double[] current = signal;
        List<double[]> details = new ArrayList<>(levels);
        for (int level = 0; level < levels; level++) {
            details.add(downsample(current, DEC_HI));
            current = downsample(current, DEC_LO);
        }
        return new Decomposition(current, details);
    }

    private static double[] downsample(double[] x, double[] filter) {
        int n = x.length;
        int f = filter.length;
        double[] out = new double[(n + f - 1) / 2];
        int o = 0;
        for (int i = 1; i < n + f - 1; i += 2, o++) {
            double sum = 0.0;
            for (int j = 0; j < f; j++) {
                sum += filter[j] * x[reflect(i - j, n)];
            }
            out[o] = sum;
        }
        return out;
    }

    static int reflect(int index, int n) {
        int i = index;
        while (i < 0 || i >= n) {
            i = i < 0 ? -i - 1 : 2 * n - i - 1;
        }
        return i;
    }
}
