package com.vibrationsentinel.core.drift;

import com.vibrationsentinel.core.model.FeatureVector;
import org.apache.commons.math3.distribution.NormalDistribution;

import java.util.List;
import java.util.Objects;

/**
 * Fixed z-space histogram used to summarize normalized feature
 * distributions, and the Population Stability Index between two such
 * summaries.
 *
 * <p>
 * Bin edges are {@code -3, -2, -1, -0.5, 0, 0.5, 1, 2, 3}, giving ten bins
 * with open outer ends. Proportions are floored at {@link #MIN_PROPORTION}
 * before the PSI logarithm.
 * </p>
 */
public final class DistributionSummary {

    static final double[] EDGES = {-3.0, -2.0, -1.0, -0.5, 0.0, 0.5, 1.0, 2.0, 3.0};

    public static final int BINS = EDGES.length + 1;

    static final double MIN_PROPORTION = 1e-4;

    private DistributionSummary() {
        // utility class, not instantiable
    }

    /**
     * @return index of the bin holding {@code z}
     */
    public static int binOf(double z) {
        int bin = 0;
        while (bin < EDGES.length && z >= EDGES[bin]) {
            bin++;
        }
        return bin;
    }

    /**
     * @return expected bin proportions of a standard normal variable, which
     *         is what healthy data looks like after normalization
     */
    public static double[] standardNormalProportions() {
        NormalDistribution normal = new NormalDistribution(0.0, 1.0);
        double[] p = new double[BINS];
        double previous = 0.0;
        for (int i = 0; i < EDGES.length; i++) {
            double cdf = normal.cumulativeProbability(EDGES[i]);
            p[i] = cdf - previous;
            previous = cdf;
        }
        p[BINS - 1] = 1.0 - previous;
        return p;
    }

    /**
     * @param features number of features
     * @return the standard-normal reference repeated for every feature
     */
    public static double[][] standardNormalReference(int features) {
        double[] p = standardNormalProportions();
        double[][] ref = new double[features][];
        for (int f = 0; f < features; f++) {
            ref[f] = p.clone();
        }
        return ref;
    }

    /**
     * Build a per-feature reference from normalized healthy vectors.
     */
    public static double[][] referenceFrom(List<FeatureVector> normalized) {
        Objects.requireNonNull(normalized, "normalized vectors must not be null");
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("At least one vector is required for a reference");
        }
        int d = normalized.get(0).size();
        long[][] counts = new long[d][BINS];
        for (FeatureVector v : normalized) {
            double[] z = v.toArray();
            for (int f = 0; f < d; f++) {
                counts[f][binOf(z[f])]++;
            }
        }
        double[][] ref = new double[d][];
        for (int f = 0; f < d; f++) {
            ref[f] = proportions(counts[f]);
        }
        return ref;
    }

    public static double[] proportions(long[] counts) {
        long total = 0;
        for (long c : counts) {
            total += c;
        }
        double[] p = new double[counts.length];
        if (total == 0) {
            return p;
        }
        for (int i = 0; i < counts.length; i++) {
            p[i] = (double) counts[i] / total;
        }
        return p;
    }

    /**
     * Population Stability Index {@code sum((a - e) * ln(a / e))}.
     */
    public static double psi(double[] expected, double[] actual) {
        if (expected.length != actual.length) {
            throw new IllegalArgumentException("Bin count mismatch: " + expected.length + " vs " + actual.length);
        }
        double psi = 0.0;
        for (int i = 0; i < expected.length; i++) {
            double e = Math.max(expected[i], MIN_PROPORTION);
            double a = Math.max(actual[i], MIN_PROPORTION);
            psi += (a - e) * Math.log(a / e);
        }
        return psi;
    }
}
