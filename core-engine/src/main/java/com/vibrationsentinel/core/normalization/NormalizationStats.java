package com.vibrationsentinel.core.normalization;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vibrationsentinel.core.error.StateCorruptionException;
import com.vibrationsentinel.core.model.FeatureSchema;
import com.vibrationsentinel.core.model.FeatureVector;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Per-feature mean and standard deviation fit on known-healthy windows.
 *
 * <p>
 * Produced offline and loaded read-only. Standard deviations are clamped
 * to at least {@link #STD_EPSILON} so that constant features never divide
 * by zero.
 * </p>
 *
 * @since 1.0.0
 */
public final class NormalizationStats implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double STD_EPSILON = 1e-8;

    private final List<String> featureNames;
    private final double[] mean;
    private final double[] std;

    /**
     * @throws StateCorruptionException if the arrays disagree in length or
     *                                  contain non-finite values
     */
    @JsonCreator
    public NormalizationStats(
            @JsonProperty("featureNames") List<String> featureNames,
            @JsonProperty("mean") double[] mean,
            @JsonProperty("std") double[] std) {
        if (featureNames == null || mean == null || std == null) {
            throw new StateCorruptionException("NormalizationStats requires featureNames, mean and std");
        }
        if (mean.length != featureNames.size() || std.length != featureNames.size()) {
            throw new StateCorruptionException("NormalizationStats length mismatch: names="
                    + featureNames.size() + ", mean=" + mean.length + ", std=" + std.length);
        }
        this.featureNames = Collections.unmodifiableList(new ArrayList<>(featureNames));
        this.mean = mean.clone();
        this.std = new double[std.length];
        for (int i = 0; i < std.length; i++) {
            if (!Double.isFinite(mean[i]) || !Double.isFinite(std[i]) || std[i] < 0) {
                throw new StateCorruptionException("Invalid statistics for feature '"
                        + featureNames.get(i) + "': mean=" + mean[i] + ", std=" + std[i]);
            }
            this.std[i] = Math.max(std[i], STD_EPSILON);
        }
    }

    /**
     * Fit population mean and standard deviation over healthy vectors.
     *
     * @param healthy at least one vector, all sharing one schema
     * @return fitted statistics
     * @throws IllegalArgumentException if {@code healthy} is empty or mixes
     *                                  schemas
     */
    public static NormalizationStats fit(List<FeatureVector> healthy) {
        Objects.requireNonNull(healthy, "healthy vectors must not be null");
        if (healthy.isEmpty()) {
            throw new IllegalArgumentException("At least one healthy vector is required");
        }
        FeatureSchema schema = healthy.get(0).getSchema();
        int d = schema.size();
        double[] mean = new double[d];
        for (FeatureVector v : healthy) {
            if (!v.getSchema().equals(schema)) {
                throw new IllegalArgumentException("All vectors must share one schema");
            }
            double[] x = v.toArray();
            for (int i = 0; i < d; i++) {
                mean[i] += x[i];
            }
        }
        int n = healthy.size();
        for (int i = 0; i < d; i++) {
            mean[i] /= n;
        }
        double[] std = new double[d];
        for (FeatureVector v : healthy) {
            double[] x = v.toArray();
            for (int i = 0; i < d; i++) {
                double dev = x[i] - mean[i];
                std[i] += dev * dev;
            }
        }
        for (int i = 0; i < d; i++) {
            std[i] = Math.sqrt(std[i] / n);
        }
        return new NormalizationStats(schema.names(), mean, std);
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public double[] getMean() {
        return mean.clone();
    }

    public double[] getStd() {
        return std.clone();
    }

    double meanAt(int i) {
        return mean[i];
    }

    double stdAt(int i) {
        return std[i];
    }

    int indexOf(String name) {
        return featureNames.indexOf(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NormalizationStats that)) {
            return false;
        }
        return featureNames.equals(that.featureNames)
                && Arrays.equals(mean, that.mean)
                && Arrays.equals(std, that.std);
    }

    @Override
    public int hashCode() {
        return Objects.hash(featureNames, Arrays.hashCode(mean), Arrays.hashCode(std));
    }

    @Override
    public String toString() {
        return "NormalizationStats{features=" + featureNames.size() + '}';
    }
}
