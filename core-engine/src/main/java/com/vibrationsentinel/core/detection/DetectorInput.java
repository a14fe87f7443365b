package com.vibrationsentinel.core.detection;

import com.vibrationsentinel.core.model.FeatureVector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable input handed to every detector on one tick.
 *
 * <p>
 * {@code history} is a snapshot of the asset's most recent normalized
 * vectors, oldest first, ending with {@code current}.
 * </p>
 */
public final class DetectorInput {

    private final FeatureVector current;
    private final List<FeatureVector> history;

    public DetectorInput(FeatureVector current, List<FeatureVector> history) {
        this.current = Objects.requireNonNull(current, "current vector must not be null");
        Objects.requireNonNull(history, "history must not be null");
        this.history = Collections.unmodifiableList(new ArrayList<>(history));
    }

    public static DetectorInput of(FeatureVector current) {
        return new DetectorInput(current, List.of(current));
    }

    public FeatureVector current() {
        return current;
    }

    public List<FeatureVector> history() {
        return history;
    }

    /**
     * @param k number of vectors wanted
     * @return the last {@code k} vectors of the history, oldest first
     * @throws IllegalArgumentException if fewer than {@code k} are available
     */
    public List<FeatureVector> lastN(int k) {
        if (k > history.size()) {
            throw new IllegalArgumentException("Requested " + k + " vectors, history holds " + history.size());
        }
        return history.subList(history.size() - k, history.size());
    }
}
