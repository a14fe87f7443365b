package com.vibrationsentinel.core.ensemble;

/**
 * What to do when a bounded call (a detector, the drift check, or the
 * whole ensemble) does not produce a fresh answer in time.
 */
public enum FallbackPolicy {

    /** Treat the collaborator as unavailable for this tick. */
    SKIP,

    /** Re-use the last good answer, flagged as stale. */
    REUSE_STALE,

    /** Propagate the failure to the caller. */
    FAIL
}
