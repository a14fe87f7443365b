package com.vibrationsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Operator confirmation of a previously emitted {@link EnsembleResult}.
 *
 * <p>
 * Delivered by the feedback channel, possibly more than once;
 * {@code feedbackId} makes redelivery idempotent.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Feedback implements Serializable {

    private static final long serialVersionUID = 1L;

    private String feedbackId;

    private String assetId;

    /** {@link EnsembleResult#getResultId()} of the judged result. */
    private String predictedAlertId;

    /** Whether the operator confirmed a real fault. */
    private boolean confirmedAnomaly;

    private Instant timestamp;

    /** No-arg constructor required by Jackson. */
    public Feedback() {
    }

    public Feedback(String feedbackId, String assetId, String predictedAlertId,
            boolean confirmedAnomaly, Instant timestamp) {
        this.feedbackId = Objects.requireNonNull(feedbackId, "feedbackId must not be null");
        this.assetId = assetId;
        this.predictedAlertId = Objects.requireNonNull(predictedAlertId, "predictedAlertId must not be null");
        this.confirmedAnomaly = confirmedAnomaly;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public String getFeedbackId() {
        return feedbackId;
    }

    public void setFeedbackId(String feedbackId) {
        this.feedbackId = feedbackId;
    }

    public String getAssetId() {
        return assetId;
    }

    public void setAssetId(String assetId) {
        this.assetId = assetId;
    }

    public String getPredictedAlertId() {
        return predictedAlertId;
    }

    public void setPredictedAlertId(String predictedAlertId) {
        this.predictedAlertId = predictedAlertId;
    }

    public boolean isConfirmedAnomaly() {
        return confirmedAnomaly;
    }

    public void setConfirmedAnomaly(boolean confirmedAnomaly) {
        this.confirmedAnomaly = confirmedAnomaly;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Feedback that))
            return false;
        return Objects.equals(feedbackId, that.feedbackId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(feedbackId);
    }

    @Override
    public String toString() {
        return "Feedback{" +
                "feedbackId='" + feedbackId + '\'' +
                ", predictedAlertId='" + predictedAlertId + '\'' +
                ", confirmedAnomaly=" + confirmedAnomaly +
                ", timestamp=" + timestamp +
                '}';
    }
}
