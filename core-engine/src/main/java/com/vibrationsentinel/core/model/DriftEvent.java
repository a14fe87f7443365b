package com.vibrationsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Advisory signal that live feature distributions have moved away from the
 * calibration reference for long enough to warrant recalibration.
 *
 * @since 1.0.0
 */
public class DriftEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private String assetId;
    private Instant timestamp;
    private double driftScore;
    private double threshold;
    private int consecutiveChecks;
    private Map<String, Double> featureDivergence = new LinkedHashMap<>();
    private String recommendation;

    /** No-arg constructor required by Jackson. */
    public DriftEvent() {
    }

    public DriftEvent(String assetId, Instant timestamp, double driftScore, double threshold,
            int consecutiveChecks, Map<String, Double> featureDivergence, String recommendation) {
        this.assetId = assetId;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.driftScore = driftScore;
        this.threshold = threshold;
        this.consecutiveChecks = consecutiveChecks;
        this.featureDivergence = featureDivergence != null
                ? new LinkedHashMap<>(featureDivergence)
                : new LinkedHashMap<>();
        this.recommendation = recommendation;
    }

    public String getAssetId() {
        return assetId;
    }

    public void setAssetId(String assetId) {
        this.assetId = assetId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public double getDriftScore() {
        return driftScore;
    }

    public void setDriftScore(double driftScore) {
        this.driftScore = driftScore;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public int getConsecutiveChecks() {
        return consecutiveChecks;
    }

    public void setConsecutiveChecks(int consecutiveChecks) {
        this.consecutiveChecks = consecutiveChecks;
    }

    public Map<String, Double> getFeatureDivergence() {
        return Collections.unmodifiableMap(featureDivergence);
    }

    public void setFeatureDivergence(Map<String, Double> featureDivergence) {
        this.featureDivergence = featureDivergence != null
                ? new LinkedHashMap<>(featureDivergence)
                : new LinkedHashMap<>();
    }

    public String getRecommendation() {
        return recommendation;
    }

    public void setRecommendation(String recommendation) {
        this.recommendation = recommendation;
    }

    @Override
    public String toString() {
        return "DriftEvent{" +
                "assetId='" + assetId + '\'' +
                ", driftScore=" + driftScore +
                ", threshold=" + threshold +
                ", consecutiveChecks=" + consecutiveChecks +
                ", timestamp=" + timestamp +
                '}';
    }
}
