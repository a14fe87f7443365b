package com.vibrationsentinel.core.detection;

import com.vibrationsentinel.core.error.CalibrationException;
import com.vibrationsentinel.core.model.FeatureSchema;
import com.vibrationsentinel.core.model.FeatureVector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered feature names a model was trained on.
 *
 * <p>
 * Vectors are rearranged into this order by name, so a model keeps working
 * when the extractor's schema is reordered or extended. Features of the
 * vector that the model does not know are ignored.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureLayout {

    private final List<String> names;
    private volatile Mapping mapping;

    /**
     * @throws IllegalArgumentException if {@code names} is empty or has
     *                                  duplicates
     */
    public FeatureLayout(List<String> names) {
        Objects.requireNonNull(names, "names must not be null");
        if (names.isEmpty()) {
            throw new IllegalArgumentException("Feature layout must name at least one feature");
        }
        Set<String> seen = new HashSet<>();
        for (String n : names) {
            if (n == null || !seen.add(n)) {
                throw new IllegalArgumentException("Feature layout has a null or duplicate name: " + n);
            }
        }
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
    }

    public static FeatureLayout of(FeatureSchema schema) {
        return new FeatureLayout(schema.names());
    }

    public List<String> names() {
        return names;
    }

    public int size() {
        return names.size();
    }

    /**
     * @return names of this layout the schema does not provide, in layout
     *         order; empty if every model input is available
     */
    public List<String> missingFrom(FeatureSchema schema) {
        List<String> missing = new ArrayList<>();
        for (String n : names) {
            if (!schema.contains(n)) {
                missing.add(n);
            }
        }
        return missing;
    }

    /**
     * @return the vector's values in model input order
     * @throws CalibrationException if the vector lacks a feature of this
     *                              layout
     */
    public double[] arrange(FeatureVector vector) {
        int[] idx = mappingFor(vector.getSchema());
        double[] values = vector.toArray();
        double[] out = new double[idx.length];
        for (int i = 0; i < idx.length; i++) {
            out[i] = values[idx[i]];
        }
        return out;
    }

    private int[] mappingFor(FeatureSchema schema) {
        Mapping m = mapping;
        if (m != null && m.schema.equals(schema)) {
            return m.indices;
        }
        List<String> missing = missingFrom(schema);
        if (!missing.isEmpty()) {
            throw new CalibrationException("Feature vector lacks model inputs " + missing);
        }
        int[] indices = new int[names.size()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = schema.indexOf(names.get(i));
        }
        mapping = new Mapping(schema, indices);
        return indices;
    }

    @Override
    public String toString() {
        return "FeatureLayout" + names;
    }

    private static final class Mapping {
        final FeatureSchema schema;
        final int[] indices;

        Mapping(FeatureSchema schema, int[] indices) {
            this.schema = schema;
            this.indices = indices;
        }
    }
}
