package com.vibrationsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Outcome of one detector for one tick.
 *
 * <p>
 * An unavailable detector carries {@link Double#NaN} as its score and a
 * reason; a stale score is a previous good value re-used after a timeout.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorScore implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String detector;
    private final double score;
    private final boolean available;
    private final boolean stale;
    private final String reason;

    @JsonCreator
    private DetectorScore(@JsonProperty("detector") String detector,
            @JsonProperty("score") double score,
            @JsonProperty("available") boolean available,
            @JsonProperty("stale") boolean stale,
            @JsonProperty("reason") String reason) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.score = score;
        this.available = available;
        this.stale = stale;
        this.reason = reason;
    }

    /**
     * @param detector detector name
     * @param score    score in [0,1]
     * @return a fresh, available score
     * @throws IllegalArgumentException if the score is outside [0,1]
     */
    public static DetectorScore available(String detector, double score) {
        return new DetectorScore(detector, requireUnit(detector, score), true, false, null);
    }

    /**
     * @param detector detector name
     * @param score    last good score in [0,1]
     * @param reason   why the fresh score is missing
     * @return an available score flagged as stale
     */
    public static DetectorScore stale(String detector, double score, String reason) {
        return new DetectorScore(detector, requireUnit(detector, score), true, true, reason);
    }

    /**
     * @param detector detector name
     * @param reason   why the detector did not contribute
     * @return an unavailable score
     */
    public static DetectorScore unavailable(String detector, String reason) {
        return new DetectorScore(detector, Double.NaN, false, false, reason);
    }

    private static double requireUnit(String detector, double score) {
        if (!(score >= 0.0 && score <= 1.0)) {
            throw new IllegalArgumentException(
                    "Score of detector '" + detector + "' must be in [0,1], got: " + score);
        }
        return score;
    }

    public String getDetector() {
        return detector;
    }

    public double getScore() {
        return score;
    }

    public boolean isAvailable() {
        return available;
    }

    public boolean isStale() {
        return stale;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorScore that))
            return false;
        return available == that.available
                && stale == that.stale
                && Double.compare(score, that.score) == 0
                && detector.equals(that.detector)
                && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(detector, score, available, stale, reason);
    }

    @Override
    public String toString() {
        if (!available) {
            return detector + "=unavailable(" + reason + ')';
        }
        return detector + '=' + score + (stale ? "(stale)" : "");
    }
}
