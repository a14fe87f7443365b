package com.vibrationsentinel.core.detection;

import com.vibrationsentinel.core.error.AvailabilityException;

import java.util.Objects;

/**
 * Stand-in for a detector whose model could not be loaded. It keeps the
 * detector's slot in the ensemble, always reported as unavailable.
 */
public final class MissingModelDetector implements AnomalyDetector {

    private final String name;
    private final String reason;

    public MissingModelDetector(String name, String reason) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public double score(DetectorInput input) {
        throw new AvailabilityException("Detector '" + name + "' has no model: " + reason);
    }

    public String getReason() {
        return reason;
    }
}
