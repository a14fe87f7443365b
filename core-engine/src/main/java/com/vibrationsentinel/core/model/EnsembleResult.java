package com.vibrationsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Classified anomaly decision for one window of one asset.
 *
 * <p>
 * Serialized to JSON and published to the configured results topic. Every
 * result lists the per-detector scores with their availability flags and the
 * renormalized weights that were actually applied, so a result built on a
 * degraded subset is distinguishable from a full-ensemble result.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code resultId}, {@code timestamp} and
 * {@code alertLevel} are required.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EnsembleResult implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Composite score above which a window is labelled anomalous, whatever the alert cuts. */
    public static final double ANOMALY_SCORE = 0.5;

    /** Identifier operators quote when confirming or rejecting the alert. */
    private String resultId;

    private String assetId;

    /** Time the result was produced. */
    private Instant timestamp;

    /** Start of the window the result describes. */
    private Instant windowStart;

    private List<DetectorScore> detectorScores = new ArrayList<>();

    /** Weights applied to the contributing detectors; sum to 1. */
    private Map<String, Double> appliedWeights = new LinkedHashMap<>();

    private double compositeScore;

    private AlertLevel alertLevel;

    private double warningCut;

    private double criticalCut;

    /** Whether the cuts came from operator feedback rather than bootstrap defaults. */
    private boolean adaptiveCuts;

    /** Whether this result was re-emitted because no detector answered. */
    private boolean stale;

    /** No-arg constructor required by Jackson. */
    public EnsembleResult() {
    }

    private EnsembleResult(Builder b) {
        this.resultId = Objects.requireNonNull(b.resultId, "resultId must not be null");
        this.assetId = b.assetId;
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.windowStart = b.windowStart;
        this.detectorScores = new ArrayList<>(b.detectorScores);
        this.appliedWeights = new LinkedHashMap<>(b.appliedWeights);
        this.compositeScore = b.compositeScore;
        this.alertLevel = Objects.requireNonNull(b.alertLevel, "alertLevel must not be null");
        this.warningCut = b.warningCut;
        this.criticalCut = b.criticalCut;
        this.adaptiveCuts = b.adaptiveCuts;
        this.stale = b.stale;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this result's values
     */
    public Builder toBuilder() {
        return new Builder()
                .resultId(resultId)
                .assetId(assetId)
                .timestamp(timestamp)
                .windowStart(windowStart)
                .detectorScores(detectorScores)
                .appliedWeights(appliedWeights)
                .compositeScore(compositeScore)
                .alertLevel(alertLevel)
                .cuts(warningCut, criticalCut, adaptiveCuts)
                .stale(stale);
    }

    /**
     * Fluent builder for {@link EnsembleResult}.
     */
    public static class Builder {
        private String resultId;
        private String assetId;
        private Instant timestamp;
        private Instant windowStart;
        private List<DetectorScore> detectorScores = new ArrayList<>();
        private Map<String, Double> appliedWeights = new LinkedHashMap<>();
        private double compositeScore;
        private AlertLevel alertLevel;
        private double warningCut;
        private double criticalCut;
        private boolean adaptiveCuts;
        private boolean stale;

        public Builder resultId(String resultId) {
            this.resultId = resultId;
            return this;
        }

        public Builder assetId(String assetId) {
            this.assetId = assetId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder windowStart(Instant windowStart) {
            this.windowStart = windowStart;
            return this;
        }

        public Builder detectorScores(List<DetectorScore> detectorScores) {
            this.detectorScores = detectorScores != null ? detectorScores : new ArrayList<>();
            return this;
        }

        public Builder appliedWeights(Map<String, Double> appliedWeights) {
            this.appliedWeights = appliedWeights != null ? appliedWeights : new LinkedHashMap<>();
            return this;
        }

        public Builder compositeScore(double compositeScore) {
            this.compositeScore = compositeScore;
            return this;
        }

        public Builder alertLevel(AlertLevel alertLevel) {
            this.alertLevel = alertLevel;
            return this;
        }

        public Builder cuts(double warningCut, double criticalCut, boolean adaptive) {
            this.warningCut = warningCut;
            this.criticalCut = criticalCut;
            this.adaptiveCuts = adaptive;
            return this;
        }

        public Builder stale(boolean stale) {
            this.stale = stale;
            return this;
        }

        public EnsembleResult build() {
            return new EnsembleResult(this);
        }
    }

    // ---------------------------------------------------------------
    // Derived views
    // ---------------------------------------------------------------

    /**
     * @return names of the detectors whose scores entered the composite
     */
    @JsonIgnore
    public List<String> getContributors() {
        List<String> names = new ArrayList<>();
        for (DetectorScore s : detectorScores) {
            if (s.isAvailable()) {
                names.add(s.getDetector());
            }
        }
        return names;
    }

    /**
     * @return {@code true} if at least one detector did not contribute
     */
    public boolean isDegraded() {
        for (DetectorScore s : detectorScores) {
            if (!s.isAvailable()) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return {@code true} if the composite score exceeds
     *         {@link #ANOMALY_SCORE}
     */
    public boolean isAnomaly() {
        return compositeScore > ANOMALY_SCORE;
    }

    /**
     * @param detector detector name
     * @return that detector's score entry, or {@code null} if it is not part of
     *         the ensemble
     */
    public DetectorScore scoreOf(String detector) {
        for (DetectorScore s : detectorScores) {
            if (s.getDetector().equals(detector)) {
                return s;
            }
        }
        return null;
    }

    /**
     * @return health implied by the composite score, {@code 1 - composite}
     */
    @JsonIgnore
    public double getHealth() {
        return 1.0 - compositeScore;
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getResultId() {
        return resultId;
    }

    public void setResultId(String resultId) {
        this.resultId = resultId;
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

    public Instant getWindowStart() {
        return windowStart;
    }

    public void setWindowStart(Instant windowStart) {
        this.windowStart = windowStart;
    }

    public List<DetectorScore> getDetectorScores() {
        return Collections.unmodifiableList(detectorScores);
    }

    public void setDetectorScores(List<DetectorScore> detectorScores) {
        this.detectorScores = detectorScores != null ? new ArrayList<>(detectorScores) : new ArrayList<>();
    }

    public Map<String, Double> getAppliedWeights() {
        return Collections.unmodifiableMap(appliedWeights);
    }

    public void setAppliedWeights(Map<String, Double> appliedWeights) {
        this.appliedWeights = appliedWeights != null ? new LinkedHashMap<>(appliedWeights) : new LinkedHashMap<>();
    }

    public double getCompositeScore() {
        return compositeScore;
    }

    public void setCompositeScore(double compositeScore) {
        this.compositeScore = compositeScore;
    }

    public AlertLevel getAlertLevel() {
        return alertLevel;
    }

    public void setAlertLevel(AlertLevel alertLevel) {
        this.alertLevel = alertLevel;
    }

    public double getWarningCut() {
        return warningCut;
    }

    public void setWarningCut(double warningCut) {
        this.warningCut = warningCut;
    }

    public double getCriticalCut() {
        return criticalCut;
    }

    public void setCriticalCut(double criticalCut) {
        this.criticalCut = criticalCut;
    }

    public boolean isAdaptiveCuts() {
        return adaptiveCuts;
    }

    public void setAdaptiveCuts(boolean adaptiveCuts) {
        this.adaptiveCuts = adaptiveCuts;
    }

    public boolean isStale() {
        return stale;
    }

    public void setStale(boolean stale) {
        this.stale = stale;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EnsembleResult that))
            return false;
        return Objects.equals(resultId, that.resultId)
                && Objects.equals(assetId, that.assetId)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resultId, assetId, timestamp);
    }

    @Override
    public String toString() {
        return "EnsembleResult{" +
                "resultId='" + resultId + '\'' +
                ", assetId='" + assetId + '\'' +
                ", composite=" + compositeScore +
                ", level=" + alertLevel +
                ", scores=" + detectorScores +
                (stale ? ", stale" : "") +
                '}';
    }
}
