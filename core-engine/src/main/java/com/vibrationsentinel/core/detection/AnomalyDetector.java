package com.vibrationsentinel.core.detection;

import java.util.Optional;

/**
 * Uniform scoring capability shared by every detector in the ensemble.
 *
 * <p>
 * Implementations wrap a model that was trained offline and loaded
 * read-only; they hold no per-asset state, so one instance may be shared
 * by every asset and called from several threads at once. Per-asset
 * context (recent history) arrives through {@link DetectorInput}.
 * </p>
 *
 * <p>
 * The ensemble depends on nothing but this interface; detectors can be
 * added, removed or replaced without touching combination logic.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * @return stable name, also used as the key of the detector's ensemble
     *         weight
     */
    String name();

    /**
     * @return {@code false} if the detector cannot score at all (for example
     *         because its model artifact is missing)
     */
    boolean isAvailable();

    /**
     * Score one normalized feature vector.
     *
     * @param input current vector plus recent history of the same asset
     * @return anomaly score in {@code [0, 1]}; higher is more anomalous
     * @throws com.vibrationsentinel.core.error.AvailabilityException if the
     *         detector cannot score this input (e.g. too little history)
     * @throws com.vibrationsentinel.core.error.ComputationException if the
     *         model produced a non-finite value
     */
    double score(DetectorInput input);

    /**
     * @return the feature names the underlying model consumes, in its input
     *         order; empty for detectors that do not read features by name
     */
    default Optional<FeatureLayout> inputLayout() {
        return Optional.empty();
    }
}
