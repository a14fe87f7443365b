package com.vibrationsentinel.core.detection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One tree of an isolation forest in flat array form.
 *
 * <p>
 * Node {@code 0} is the root. An internal node sends {@code x} to
 * {@code left[n]} when {@code x[feature[n]] < threshold[n]} and to
 * {@code right[n]} otherwise. A leaf has {@code feature[n] == -1} and
 * records how many training points reached it in {@code size[n]}.
 * </p>
 */
public final class IsolationTree {

    static final int LEAF = -1;

    private final int[] feature;
    private final double[] threshold;
    private final int[] left;
    private final int[] right;
    private final int[] size;

    @JsonCreator
    public IsolationTree(
            @JsonProperty("feature") int[] feature,
            @JsonProperty("threshold") double[] threshold,
            @JsonProperty("left") int[] left,
            @JsonProperty("right") int[] right,
            @JsonProperty("size") int[] size) {
        Objects.requireNonNull(feature, "feature must not be null");
        Objects.requireNonNull(threshold, "threshold must not be null");
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
        Objects.requireNonNull(size, "size must not be null");
        int n = feature.length;
        if (n == 0 || threshold.length != n || left.length != n || right.length != n || size.length != n) {
            throw new IllegalArgumentException("Tree arrays must be non-empty and equally long");
        }
        for (int i = 0; i < n; i++) {
            if (feature[i] != LEAF && (left[i] <= i || right[i] <= i || left[i] >= n || right[i] >= n)) {
                throw new IllegalArgumentException("Node " + i + " has invalid children");
            }
        }
        this.feature = feature;
        this.threshold = threshold;
        this.left = left;
        this.right = right;
        this.size = size;
    }

    /**
     * @return path length of {@code x}, including the average-path correction
     *         for the leaf it lands in
     */
    public double pathLength(double[] x) {
        int node = 0;
        int depth = 0;
        while (feature[node] != LEAF) {
            node = x[feature[node]] < threshold[node] ? left[node] : right[node];
            depth++;
        }
        return depth + IsolationForestModel.averagePathLength(size[node]);
    }

    /**
     * @return highest feature position any split reads, or {@code -1} for a
     *         single-leaf tree
     */
    int maxFeatureIndex() {
        int max = LEAF;
        for (int f : feature) {
            max = Math.max(max, f);
        }
        return max;
    }

    public int[] getFeature() {
        return feature;
    }

    public double[] getThreshold() {
        return threshold;
    }

    public int[] getLeft() {
        return left;
    }

    public int[] getRight() {
        return right;
    }

    public int[] getSize() {
        return size;
    }
}
