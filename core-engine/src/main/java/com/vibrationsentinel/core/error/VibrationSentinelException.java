package com.vibrationsentinel.core.error;

/**
 * Root of the pipeline's unchecked exception hierarchy.
 *
 * <p>
 * Subclasses fall into five categories that determine how a failure
 * propagates:
 * </p>
 * <ul>
 * <li>{@link InputException}: malformed or insufficient samples; surfaces to
 * the caller at stream boundaries</li>
 * <li>{@link ComputationException}: NaN/Inf in a feature or score; degrades
 * the affected window only</li>
 * <li>{@link AvailabilityException}: a detector or required history is
 * missing this tick; degrades the ensemble only</li>
 * <li>{@link CalibrationException}: scoring attempted before stats or
 * thresholds are fit; fatal to the asset's pipeline</li>
 * <li>{@link StateCorruptionException}: persisted state fails an invariant
 * on load; fatal to the asset's pipeline</li>
 * </ul>
 *
 * @since 1.0.0
 */
public abstract class VibrationSentinelException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected VibrationSentinelException(String message) {
        super(message);
    }

    protected VibrationSentinelException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return {@code true} if this failure must stop the asset's pipeline
     *         instead of degrading a single window or detector
     */
    public boolean isFatal() {
        return false;
    }
}
