package com.vibrationsentinel.core.detection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Objects;

/**
 * Maps a raw detector statistic onto {@code [0, 1]} using anchors fit once
 * on held-out healthy data: the healthy median maps to 0 and the healthy
 * 95th percentile maps to 1. Values outside are clamped.
 *
 * @since 1.0.0
 */
public final class PercentileScaler {

    private static final double MIN_SPAN = 1e-12;

    private final double median;
    private final double p95;

    @JsonCreator
    public PercentileScaler(@JsonProperty("median") double median, @JsonProperty("p95") double p95) {
        if (!Double.isFinite(median) || !Double.isFinite(p95)) {
            throw new IllegalArgumentException("Scaler anchors must be finite: median=" + median + ", p95=" + p95);
        }
        if (p95 < median) {
            throw new IllegalArgumentException("p95 (" + p95 + ") must be >= median (" + median + ")");
        }
        this.median = median;
        this.p95 = p95;
    }

    /**
     * @param healthyValues raw statistics observed on healthy data; at least
     *                      one value
     */
    public static PercentileScaler fit(double[] healthyValues) {
        Objects.requireNonNull(healthyValues, "healthyValues must not be null");
        if (healthyValues.length == 0) {
            throw new IllegalArgumentException("At least one healthy value is required");
        }
        Percentile percentile = new Percentile();
        percentile.setData(healthyValues);
        return new PercentileScaler(percentile.evaluate(50.0), percentile.evaluate(95.0));
    }

    public double scale(double raw) {
        double span = Math.max(p95 - median, MIN_SPAN);
        double scaled = (raw - median) / span;
        if (scaled < 0.0) {
            return 0.0;
        }
        return Math.min(scaled, 1.0);
    }

    public double getMedian() {
        return median;
    }

    public double getP95() {
        return p95;
    }

    @Override
    public String toString() {
        return "PercentileScaler{median=" + median + ", p95=" + p95 + '}';
    }
}
