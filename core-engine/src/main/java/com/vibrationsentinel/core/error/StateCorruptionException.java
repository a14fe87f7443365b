package com.vibrationsentinel.core.error;

/**
 * Persisted state failed an invariant or schema check on load. Fatal to the
 * asset's pipeline.
 */
public class StateCorruptionException extends VibrationSentinelException {

    private static final long serialVersionUID = 1L;

    public StateCorruptionException(String message) {
        super(message);
    }

    public StateCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
