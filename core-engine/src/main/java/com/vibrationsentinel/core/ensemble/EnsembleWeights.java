package com.vibrationsentinel.core.ensemble;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable detector weights and their renormalization over whichever
 * subset of detectors answered on a tick.
 *
 * @since 1.0.0
 */
public final class EnsembleWeights {

    private final Map<String, Double> weights;

    /**
     * @param weights non-negative, finite weight per detector name with a
     *                positive sum
     * @throws IllegalArgumentException if any weight is invalid
     */
    public EnsembleWeights(Map<String, Double> weights) {
        Objects.requireNonNull(weights, "weights must not be null");
        if (weights.isEmpty()) {
            throw new IllegalArgumentException("At least one detector weight is required");
        }
        double sum = 0.0;
        for (Map.Entry<String, Double> e : weights.entrySet()) {
            Double w = e.getValue();
            if (w == null || !Double.isFinite(w) || w < 0.0) {
                throw new IllegalArgumentException("Weight of '" + e.getKey() + "' must be finite and >= 0, got: " + w);
            }
            sum += w;
        }
        if (!(sum > 0.0)) {
            throw new IllegalArgumentException("Detector weights must not all be zero");
        }
        this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    public Map<String, Double> asMap() {
        return weights;
    }

    public double weightOf(String detector) {
        return weights.getOrDefault(detector, 0.0);
    }

    /**
     * Rescale the configured weights of {@code available} so they sum to 1.
     * When every available detector has zero configured weight, they share
     * equally.
     *
     * @param available names of the detectors contributing this tick; must
     *                  not be empty
     * @return weight per available detector, in iteration order of
     *         {@code available}
     */
    public Map<String, Double> renormalize(Collection<String> available) {
        Objects.requireNonNull(available, "available must not be null");
        if (available.isEmpty()) {
            throw new IllegalArgumentException("Cannot renormalize over an empty detector set");
        }
        double sum = 0.0;
        for (String name : available) {
            sum += weightOf(name);
        }
        Map<String, Double> out = new LinkedHashMap<>();
        for (String name : available) {
            out.put(name, sum > 0.0 ? weightOf(name) / sum : 1.0 / available.size());
        }
        return out;
    }

    @Override
    public String toString() {
        return "EnsembleWeights" + weights;
    }
}
