package com.vibrationsentinel.core.normalization;

import com.vibrationsentinel.core.error.CalibrationException;
import com.vibrationsentinel.core.error.UnfittedStatsException;
import com.vibrationsentinel.core.model.FeatureSchema;
import com.vibrationsentinel.core.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.Objects;

/**
 * Standardizes raw feature vectors: {@code z = (v - mean) / std},
 * matched by feature name.
 *
 * <p>
 * A normalizer without loaded statistics rejects every call with
 * {@link UnfittedStatsException}. The name-to-index mapping is resolved once
 * per schema and cached.
 * </p>
 */
public final class Normalizer implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(Normalizer.class);

    private volatile NormalizationStats stats;
    private transient volatile Mapping mapping;

    public Normalizer() {
    }

    public Normalizer(NormalizationStats stats) {
        load(stats);
    }

    /**
     * Replace the statistics used for subsequent calls.
     */
    public void load(NormalizationStats stats) {
        this.stats = Objects.requireNonNull(stats, "stats must not be null");
        this.mapping = null;
        LOG.info("Loaded normalization statistics for {} features", stats.getFeatureNames().size());
    }

    public boolean isFitted() {
        return stats != null;
    }

    public NormalizationStats getStats() {
        return stats;
    }

    /**
     * @param raw raw feature vector
     * @return the standardized vector, same schema and window metadata
     * @throws UnfittedStatsException if no statistics are loaded
     * @throws CalibrationException   if the statistics lack a feature of
     *                                {@code raw}'s schema
     */
    public FeatureVector normalize(FeatureVector raw) {
        Objects.requireNonNull(raw, "raw vector must not be null");
        NormalizationStats s = stats;
        if (s == null) {
            throw new UnfittedStatsException("Normalizer invoked before statistics were loaded");
        }
        int[] idx = mappingFor(s, raw.getSchema());
        double[] x = raw.toArray();
        double[] z = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            z[i] = (x[i] - s.meanAt(idx[i])) / s.stdAt(idx[i]);
        }
        return raw.withValues(z);
    }

    private int[] mappingFor(NormalizationStats s, FeatureSchema schema) {
        Mapping m = mapping;
        if (m != null && m.stats == s && m.schema.equals(schema)) {
            return m.indices;
        }
        int[] indices = new int[schema.size()];
        for (int i = 0; i < schema.size(); i++) {
            int j = s.indexOf(schema.nameAt(i));
            if (j < 0) {
                throw new CalibrationException("Normalization statistics have no entry for feature '"
                        + schema.nameAt(i) + "'");
            }
            indices[i] = j;
        }
        mapping = new Mapping(s, schema, indices);
        return indices;
    }

    private static final class Mapping {
        final NormalizationStats stats;
        final FeatureSchema schema;
        final int[] indices;

        Mapping(NormalizationStats stats, FeatureSchema schema, int[] indices) {
            this.stats = stats;
            this.schema = schema;
            this.indices = indices;
        }
    }
}
