package com.vibrationsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Remaining-useful-life projection for one asset.
 *
 * <p>
 * Either {@link Status#AVAILABLE}, with a point estimate and confidence
 * bounds, or {@link Status#UNAVAILABLE} with a reason.
 * </p>
 *
 * @since 1.0.0
 */
public class RulEstimate implements Serializable {

    private static final long serialVersionUID = 1L;

    public enum Status {
        AVAILABLE,
        UNAVAILABLE
    }

    private String assetId;
    private Status status;
    private String reason;
    private Instant timestamp;
    private Duration remaining;
    private Duration lowerBound;
    private Duration upperBound;
    private double currentHealth;
    private double slopePerHour;
    private String trendModel;
    private int historySize;

    /** No-arg constructor required by Jackson. */
    public RulEstimate() {
    }

    public static RulEstimate unavailable(String assetId, Instant timestamp, String reason, int historySize) {
        RulEstimate e = new RulEstimate();
        e.assetId = assetId;
        e.status = Status.UNAVAILABLE;
        e.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        e.reason = reason;
        e.historySize = historySize;
        return e;
    }

    public static RulEstimate available(String assetId, Instant timestamp, Duration remaining,
            Duration lowerBound, Duration upperBound, double currentHealth, double slopePerHour,
            String trendModel, int historySize) {
        RulEstimate e = new RulEstimate();
        e.assetId = assetId;
        e.status = Status.AVAILABLE;
        e.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        e.remaining = Objects.requireNonNull(remaining, "remaining must not be null");
        e.lowerBound = lowerBound;
        e.upperBound = upperBound;
        e.currentHealth = currentHealth;
        e.slopePerHour = slopePerHour;
        e.trendModel = trendModel;
        e.historySize = historySize;
        return e;
    }

    @JsonIgnore
    public boolean isAvailable() {
        return status == Status.AVAILABLE;
    }

    public String getAssetId() {
        return assetId;
    }

    public void setAssetId(String assetId) {
        this.assetId = assetId;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public Duration getRemaining() {
        return remaining;
    }

    public void setRemaining(Duration remaining) {
        this.remaining = remaining;
    }

    public Duration getLowerBound() {
        return lowerBound;
    }

    public void setLowerBound(Duration lowerBound) {
        this.lowerBound = lowerBound;
    }

    public Duration getUpperBound() {
        return upperBound;
    }

    public void setUpperBound(Duration upperBound) {
        this.upperBound = upperBound;
    }

    public double getCurrentHealth() {
        return currentHealth;
    }

    public void setCurrentHealth(double currentHealth) {
        this.currentHealth = currentHealth;
    }

    public double getSlopePerHour() {
        return slopePerHour;
    }

    public void setSlopePerHour(double slopePerHour) {
        this.slopePerHour = slopePerHour;
    }

    public String getTrendModel() {
        return trendModel;
    }

    public void setTrendModel(String trendModel) {
        this.trendModel = trendModel;
    }

    public int getHistorySize() {
        return historySize;
    }

    public void setHistorySize(int historySize) {
        this.historySize = historySize;
    }

    @Override
    public String toString() {
        if (status != Status.AVAILABLE) {
            return "RulEstimate{assetId='" + assetId + "', UNAVAILABLE: " + reason + '}';
        }
        return "RulEstimate{" +
                "assetId='" + assetId + '\'' +
                ", remaining=" + remaining +
                ", bounds=[" + lowerBound + ", " + upperBound + ']' +
                ", health=" + currentHealth +
                '}';
    }
}
