package com.vibrationsentinel.core.model;

import com.vibrationsentinel.core.error.FeatureComputationException;

import java.io.Serializable;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named feature values summarising one {@link Window}.
 *
 * <p>
 * Values are always finite: construction fails with
 * {@link FeatureComputationException} otherwise. Look values up by name via
 * {@link #get(String)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureVector implements Serializable {

    private static final long serialVersionUID = 1L;

    private final FeatureSchema schema;
    private final double[] values;
    private final Instant windowStart;
    private final long windowSequence;

    /**
     * @param schema         feature schema; must not be {@code null}
     * @param values         feature values in schema order; copied
     * @param windowStart    start timestamp of the source window
     * @param windowSequence sequence number of the source window
     * @throws IllegalArgumentException    if the value count does not match the
     *                                     schema
     * @throws FeatureComputationException if any value is NaN or infinite
     */
    public FeatureVector(FeatureSchema schema, double[] values, Instant windowStart, long windowSequence) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(values, "values must not be null");
        this.windowStart = Objects.requireNonNull(windowStart, "windowStart must not be null");
        if (values.length != schema.size()) {
            throw new IllegalArgumentException(
                    "Expected " + schema.size() + " feature values, got: " + values.length);
        }
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new FeatureComputationException(schema.nameAt(i), values[i]);
            }
        }
        this.values = values.clone();
        this.windowSequence = windowSequence;
    }

    public FeatureSchema getSchema() {
        return schema;
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public long getWindowSequence() {
        return windowSequence;
    }

    public int size() {
        return values.length;
    }

    /**
     * @param name feature name
     * @return the feature value
     * @throws IllegalArgumentException if the schema has no such feature
     */
    public double get(String name) {
        return values[schema.indexOf(name)];
    }

    /**
     * @return a copy of all values in schema order
     */
    public double[] toArray() {
        return values.clone();
    }

    /**
     * @return feature name to value, in schema order
     */
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(schema.nameAt(i), values[i]);
        }
        return map;
    }

    /**
     * Create a vector with the same schema and source window but new values.
     *
     * @param newValues values in schema order
     * @return a new vector
     */
    public FeatureVector withValues(double[] newValues) {
        return new FeatureVector(schema, newValues, windowStart, windowSequence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureVector that))
            return false;
        return windowSequence == that.windowSequence
                && schema.equals(that.schema)
                && windowStart.equals(that.windowStart)
                && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, windowStart, windowSequence) * 31 + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector{window=" + windowSequence + ", " + asMap() + '}';
    }
}
