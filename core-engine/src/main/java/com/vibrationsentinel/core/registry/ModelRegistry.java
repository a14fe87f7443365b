package com.vibrationsentinel.core.registry;

import com.vibrationsentinel.core.detection.AnomalyDetector;
import com.vibrationsentinel.core.normalization.NormalizationStats;

import java.util.List;
import java.util.Optional;

/**
 * Source of the read-only artifacts produced offline: normalization
 * statistics and trained detectors.
 */
public interface ModelRegistry {

    /**
     * @return the healthy-data statistics, if published
     */
    Optional<NormalizationStats> normalizationStats();

    /**
     * Load every known detector. A detector whose artifact is missing or
     * unreadable is returned as an unavailable placeholder so the ensemble
     * keeps its slot.
     *
     * @return detectors in ensemble order
     */
    List<AnomalyDetector> detectors();
}
