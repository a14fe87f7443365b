package com.vibrationsentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered list of named, domain-tagged features.
 *
 * <p>
 * Consumers resolve features through {@link #indexOf(String)} rather than
 * hard-coded positions so that the schema can evolve without silently
 * shifting meaning.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureSchema implements Serializable {

    private static final long serialVersionUID = 1L;

    /** The 30-feature schema produced by the feature extractor. */
    public static final FeatureSchema DEFAULT = builder()
            .add("rms", FeatureDomain.TIME)
            .add("peak", FeatureDomain.TIME)
            .add("crest_factor", FeatureDomain.TIME)
            .add("kurtosis", FeatureDomain.TIME)
            .add("skewness", FeatureDomain.TIME)
            .add("std_dev", FeatureDomain.TIME)
            .add("energy", FeatureDomain.TIME)
            .add("mean_abs_value", FeatureDomain.TIME)
            .add("peak_to_peak", FeatureDomain.TIME)
            .add("impulse_factor", FeatureDomain.TIME)
            .add("dominant_freq", FeatureDomain.FREQUENCY)
            .add("spectral_centroid", FeatureDomain.FREQUENCY)
            .add("spectral_rolloff_85", FeatureDomain.FREQUENCY)
            .add("spectral_spread", FeatureDomain.FREQUENCY)
            .add("band_power_0_1k", FeatureDomain.FREQUENCY)
            .add("band_power_1_2k", FeatureDomain.FREQUENCY)
            .add("band_power_2_5k", FeatureDomain.FREQUENCY)
            .add("band_power_5_10k", FeatureDomain.FREQUENCY)
            .add("freq_variance", FeatureDomain.FREQUENCY)
            .add("spectral_kurtosis", FeatureDomain.FREQUENCY)
            .add("wavelet_detail_energy_1", FeatureDomain.WAVELET)
            .add("wavelet_detail_energy_2", FeatureDomain.WAVELET)
            .add("wavelet_detail_energy_3", FeatureDomain.WAVELET)
            .add("wavelet_detail_energy_4", FeatureDomain.WAVELET)
            .add("wavelet_approx_energy_4", FeatureDomain.WAVELET)
            .add("wavelet_entropy_1", FeatureDomain.WAVELET)
            .add("wavelet_entropy_2", FeatureDomain.WAVELET)
            .add("wavelet_entropy_3", FeatureDomain.WAVELET)
            .add("wavelet_entropy_4", FeatureDomain.WAVELET)
            .add("wavelet_variance", FeatureDomain.WAVELET)
            .build();

    private final List<String> names;
    private final List<FeatureDomain> domains;
    private final Map<String, Integer> index;

    private FeatureSchema(List<String> names, List<FeatureDomain> domains) {
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
        this.domains = Collections.unmodifiableList(new ArrayList<>(domains));
        Map<String, Integer> idx = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            if (idx.put(names.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate feature name: " + names.get(i));
            }
        }
        this.index = Collections.unmodifiableMap(idx);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return names.size();
    }

    /**
     * @return unmodifiable, ordered feature names
     */
    public List<String> names() {
        return names;
    }

    public String nameAt(int position) {
        return names.get(position);
    }

    public FeatureDomain domainOf(String name) {
        return domains.get(indexOf(name));
    }

    public boolean contains(String name) {
        return index.containsKey(name);
    }

    /**
     * @param name feature name
     * @return position of the feature
     * @throws IllegalArgumentException if the schema has no such feature
     */
    public int indexOf(String name) {
        Integer i = index.get(name);
        if (i == null) {
            throw new IllegalArgumentException("Unknown feature: '" + name + "'");
        }
        return i;
    }

    /**
     * @param domain a signal domain
     * @return names of the features computed in that domain, in schema order
     */
    public List<String> namesIn(FeatureDomain domain) {
        List<String> result = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            if (domains.get(i) == domain) {
                result.add(names.get(i));
            }
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureSchema that))
            return false;
        return names.equals(that.names) && domains.equals(that.domains);
    }

    @Override
    public int hashCode() {
        return Objects.hash(names, domains);
    }

    @Override
    public String toString() {
        return "FeatureSchema" + names;
    }

    /**
     * Fluent builder preserving insertion order.
     */
    public static class Builder {
        private final List<String> names = new ArrayList<>();
        private final List<FeatureDomain> domains = new ArrayList<>();

        public Builder add(String name, FeatureDomain domain) {
            names.add(Objects.requireNonNull(name, "name must not be null"));
            domains.add(Objects.requireNonNull(domain, "domain must not be null"));
            return this;
        }

        public FeatureSchema build() {
            return new FeatureSchema(names, domains);
        }
    }
}
