package com.vibrationsentinel.core.drift;

import com.vibrationsentinel.core.error.StateCorruptionException;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted per-asset drift monitoring state.
 *
 * <p>
 * {@code reference} and {@code currentCounts} are indexed
 * {@code [feature][bin]} in the order of {@code featureNames}.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftState implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<String> featureNames = new ArrayList<>();
    private double[][] reference;
    private long[][] currentCounts;
    private int windowsSinceCheck;
    private double divergence;
    private Map<String, Double> featureDivergence = new LinkedHashMap<>();
    private int consecutiveOverThreshold;
    private Instant lastCheck;
    private long checks;

    public DriftState() {
    }

    public DriftState(List<String> featureNames, double[][] reference) {
        this.featureNames = new ArrayList<>(featureNames);
        this.reference = reference;
        this.currentCounts = new long[featureNames.size()][DistributionSummary.BINS];
    }

    public DriftState copy() {
        DriftState c = new DriftState();
        c.featureNames = new ArrayList<>(featureNames);
        c.reference = deepCopy(reference);
        c.currentCounts = new long[currentCounts.length][];
        for (int f = 0; f < currentCounts.length; f++) {
            c.currentCounts[f] = currentCounts[f].clone();
        }
        c.windowsSinceCheck = windowsSinceCheck;
        c.divergence = divergence;
        c.featureDivergence = new LinkedHashMap<>(featureDivergence);
        c.consecutiveOverThreshold = consecutiveOverThreshold;
        c.lastCheck = lastCheck;
        c.checks = checks;
        return c;
    }

    /**
     * @throws StateCorruptionException if dimensions or proportions are
     *                                  inconsistent
     */
    public void checkInvariants() {
        if (featureNames == null || reference == null || currentCounts == null) {
            throw new StateCorruptionException("DriftState is missing feature names, reference or counts");
        }
        int d = featureNames.size();
        if (reference.length != d || currentCounts.length != d) {
            throw new StateCorruptionException("DriftState dimension mismatch: features=" + d
                    + ", reference=" + reference.length + ", counts=" + currentCounts.length);
        }
        for (int f = 0; f < d; f++) {
            if (reference[f] == null || reference[f].length != DistributionSummary.BINS
                    || currentCounts[f] == null || currentCounts[f].length != DistributionSummary.BINS) {
                throw new StateCorruptionException("DriftState has wrong bin count for feature " + featureNames.get(f));
            }
            double sum = 0.0;
            for (double p : reference[f]) {
                if (!(p >= 0.0)) {
                    throw new StateCorruptionException("Negative reference proportion for " + featureNames.get(f));
                }
                sum += p;
            }
            if (Math.abs(sum - 1.0) > 1e-6) {
                throw new StateCorruptionException("Reference proportions for " + featureNames.get(f)
                        + " sum to " + sum);
            }
            for (long c : currentCounts[f]) {
                if (c < 0) {
                    throw new StateCorruptionException("Negative bin count for " + featureNames.get(f));
                }
            }
        }
        if (windowsSinceCheck < 0 || consecutiveOverThreshold < 0) {
            throw new StateCorruptionException("DriftState counters must be non-negative");
        }
    }

    private static double[][] deepCopy(double[][] src) {
        double[][] out = new double[src.length][];
        for (int i = 0; i < src.length; i++) {
            out[i] = src[i].clone();
        }
        return out;
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public void setFeatureNames(List<String> featureNames) {
        this.featureNames = featureNames;
    }

    public double[][] getReference() {
        return reference;
    }

    public void setReference(double[][] reference) {
        this.reference = reference;
    }

    public long[][] getCurrentCounts() {
        return currentCounts;
    }

    public void setCurrentCounts(long[][] currentCounts) {
        this.currentCounts = currentCounts;
    }

    public int getWindowsSinceCheck() {
        return windowsSinceCheck;
    }

    public void setWindowsSinceCheck(int windowsSinceCheck) {
        this.windowsSinceCheck = windowsSinceCheck;
    }

    public double getDivergence() {
        return divergence;
    }

    public void setDivergence(double divergence) {
        this.divergence = divergence;
    }

    public Map<String, Double> getFeatureDivergence() {
        return featureDivergence;
    }

    public void setFeatureDivergence(Map<String, Double> featureDivergence) {
        this.featureDivergence = featureDivergence;
    }

    public int getConsecutiveOverThreshold() {
        return consecutiveOverThreshold;
    }

    public void setConsecutiveOverThreshold(int consecutiveOverThreshold) {
        this.consecutiveOverThreshold = consecutiveOverThreshold;
    }

    public Instant getLastCheck() {
        return lastCheck;
    }

    public void setLastCheck(Instant lastCheck) {
        this.lastCheck = lastCheck;
    }

    public long getChecks() {
        return checks;
    }

    public void setChecks(long checks) {
        this.checks = checks;
    }

    @Override
    public String toString() {
        return "DriftState{divergence=" + divergence + ", consecutive=" + consecutiveOverThreshold
                + ", sinceCheck=" + windowsSinceCheck + ", checks=" + checks + '}';
    }
}
