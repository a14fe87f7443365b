package com.vibrationsentinel.core.detection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ensemble of {@link IsolationTree}s. Anomalies are isolated in fewer
 * splits, so a short mean path length means a high score.
 *
 * <p>
 * {@code score(x) = 2^(-E[h(x)] / c(psi))} where {@code psi} is the
 * per-tree subsample size and {@code c} the average unsuccessful-search
 * path length of a binary search tree.
 * </p>
 */
public final class IsolationForestModel {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final List<IsolationTree> trees;
    private final int sampleSize;

    @JsonCreator
    public IsolationForestModel(
            @JsonProperty("trees") List<IsolationTree> trees,
            @JsonProperty("sampleSize") int sampleSize) {
        Objects.requireNonNull(trees, "trees must not be null");
        if (trees.isEmpty()) {
            throw new IllegalArgumentException("Forest needs at least one tree");
        }
        if (sampleSize < 2) {
            throw new IllegalArgumentException("sampleSize must be >= 2, got: " + sampleSize);
        }
        this.trees = Collections.unmodifiableList(new ArrayList<>(trees));
        this.sampleSize = sampleSize;
    }

    /**
     * @return isolation score in {@code (0, 1]}; about 0.5 for typical points
     */
    public double anomalyScore(double[] x) {
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(x);
        }
        double mean = total / trees.size();
        return Math.pow(2.0, -mean / averagePathLength(sampleSize));
    }

    int maxFeatureIndex() {
        int max = IsolationTree.LEAF;
        for (IsolationTree tree : trees) {
            max = Math.max(max, tree.maxFeatureIndex());
        }
        return max;
    }

    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    public List<IsolationTree> getTrees() {
        return trees;
    }

    public int getSampleSize() {
        return sampleSize;
    }
}
