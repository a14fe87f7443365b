package com.vibrationsentinel.core.ensemble;

/**
 * Overall readiness of the detector ensemble.
 */
public enum EnsembleHealth {

    /** Every detector is available. */
    HEALTHY,

    /** Some, but not all, detectors are available. */
    DEGRADED,

    /** No detector is available. */
    UNHEALTHY
}
