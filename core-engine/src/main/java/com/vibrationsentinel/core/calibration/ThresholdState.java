package com.vibrationsentinel.core.calibration;

import com.vibrationsentinel.core.error.StateCorruptionException;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted per-asset decision boundary state, mutated only by
 * {@link AdaptiveThreshold}.
 *
 * <p>
 * Mutable POJO with a no-arg constructor for Jackson; collections are
 * copied by {@link #copy()} so a snapshot never aliases live state.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdState implements Serializable {

    private static final long serialVersionUID = 1L;

    private double warningCut;
    private double criticalCut;
    private boolean adaptive;
    private double rollingFalsePositiveRate;
    private double rollingTruePositiveRate;
    private Instant lastUpdated;

    /** Labeled (score, confirmed) pairs inside the feedback window, oldest first. */
    private List<LabeledOutcome> feedback = new ArrayList<>();

    /** Feedback ids already applied, with the time they arrived. */
    private Map<String, Instant> seenFeedbackIds = new LinkedHashMap<>();

    /** Emitted results awaiting possible feedback, keyed by result id, oldest first. */
    private Map<String, TrackedPrediction> predictions = new LinkedHashMap<>();

    public ThresholdState() {
    }

    public ThresholdState(double warningCut, double criticalCut) {
        this.warningCut = warningCut;
        this.criticalCut = criticalCut;
    }

    /**
     * @return a deep copy of this state
     */
    public ThresholdState copy() {
        ThresholdState c = new ThresholdState(warningCut, criticalCut);
        c.adaptive = adaptive;
        c.rollingFalsePositiveRate = rollingFalsePositiveRate;
        c.rollingTruePositiveRate = rollingTruePositiveRate;
        c.lastUpdated = lastUpdated;
        for (LabeledOutcome o : feedback) {
            c.feedback.add(new LabeledOutcome(o.feedbackId, o.resultId, o.score, o.anomaly, o.timestamp));
        }
        c.seenFeedbackIds.putAll(seenFeedbackIds);
        predictions.forEach((k, v) -> c.predictions.put(k, new TrackedPrediction(v.score, v.timestamp)));
        return c;
    }

    /**
     * @throws StateCorruptionException if the state cannot have been produced
     *                                  by {@link AdaptiveThreshold}
     */
    public void checkInvariants() {
        if (!(warningCut >= 0.0 && criticalCut <= 1.0 && criticalCut > warningCut)) {
            throw new StateCorruptionException("ThresholdState violates 0 <= warningCut < criticalCut <= 1: warning="
                    + warningCut + ", critical=" + criticalCut);
        }
        if (feedback == null || seenFeedbackIds == null || predictions == null) {
            throw new StateCorruptionException("ThresholdState has missing collections");
        }
        for (LabeledOutcome o : feedback) {
            if (o == null || o.feedbackId == null || !(o.score >= 0.0 && o.score <= 1.0)) {
                throw new StateCorruptionException("ThresholdState has an invalid feedback entry: " + o);
            }
        }
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

    public boolean isAdaptive() {
        return adaptive;
    }

    public void setAdaptive(boolean adaptive) {
        this.adaptive = adaptive;
    }

    public double getRollingFalsePositiveRate() {
        return rollingFalsePositiveRate;
    }

    public void setRollingFalsePositiveRate(double rollingFalsePositiveRate) {
        this.rollingFalsePositiveRate = rollingFalsePositiveRate;
    }

    public double getRollingTruePositiveRate() {
        return rollingTruePositiveRate;
    }

    public void setRollingTruePositiveRate(double rollingTruePositiveRate) {
        this.rollingTruePositiveRate = rollingTruePositiveRate;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public void setLastUpdated(Instant lastUpdated) {
        this.lastUpdated = lastUpdated;
    }

    public List<LabeledOutcome> getFeedback() {
        return feedback;
    }

    public void setFeedback(List<LabeledOutcome> feedback) {
        this.feedback = feedback;
    }

    public Map<String, Instant> getSeenFeedbackIds() {
        return seenFeedbackIds;
    }

    public void setSeenFeedbackIds(Map<String, Instant> seenFeedbackIds) {
        this.seenFeedbackIds = seenFeedbackIds;
    }

    public Map<String, TrackedPrediction> getPredictions() {
        return predictions;
    }

    public void setPredictions(Map<String, TrackedPrediction> predictions) {
        this.predictions = predictions;
    }

    @Override
    public String toString() {
        return "ThresholdState{warning=" + warningCut + ", critical=" + criticalCut
                + ", adaptive=" + adaptive + ", feedback=" + feedback.size()
                + ", fpr=" + rollingFalsePositiveRate + ", tpr=" + rollingTruePositiveRate + '}';
    }

    // ---------------------------------------------------------------
    // Nested types
    // ---------------------------------------------------------------

    /** One operator-confirmed outcome joined with the score it refers to. */
    public static class LabeledOutcome implements Serializable {

        private static final long serialVersionUID = 1L;

        private String feedbackId;
        private String resultId;
        private double score;
        private boolean anomaly;
        private Instant timestamp;

        public LabeledOutcome() {
        }

        public LabeledOutcome(String feedbackId, String resultId, double score, boolean anomaly, Instant timestamp) {
            this.feedbackId = feedbackId;
            this.resultId = resultId;
            this.score = score;
            this.anomaly = anomaly;
            this.timestamp = timestamp;
        }

        public String getFeedbackId() {
            return feedbackId;
        }

        public void setFeedbackId(String feedbackId) {
            this.feedbackId = feedbackId;
        }

        public String getResultId() {
            return resultId;
        }

        public void setResultId(String resultId) {
            this.resultId = resultId;
        }

        public double getScore() {
            return score;
        }

        public void setScore(double score) {
            this.score = score;
        }

        public boolean isAnomaly() {
            return anomaly;
        }

        public void setAnomaly(boolean anomaly) {
            this.anomaly = anomaly;
        }

        public Instant getTimestamp() {
            return timestamp;
        }

        public void setTimestamp(Instant timestamp) {
            this.timestamp = timestamp;
        }

        @Override
        public String toString() {
            return "LabeledOutcome{" + feedbackId + ", score=" + score + ", anomaly=" + anomaly + '}';
        }
    }

    /** Composite score of an emitted result, remembered for joining feedback. */
    public static class TrackedPrediction implements Serializable {

        private static final long serialVersionUID = 1L;

        private double score;
        private Instant timestamp;

        public TrackedPrediction() {
        }

        public TrackedPrediction(double score, Instant timestamp) {
            this.score = score;
            this.timestamp = timestamp;
        }

        public double getScore() {
            return score;
        }

        public void setScore(double score) {
            this.score = score;
        }

        public Instant getTimestamp() {
            return timestamp;
        }

        public void setTimestamp(Instant timestamp) {
            this.timestamp = timestamp;
        }
    }
}
