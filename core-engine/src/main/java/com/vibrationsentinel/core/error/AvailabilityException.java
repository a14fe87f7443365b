package com.vibrationsentinel.core.error;

/**
 * A detector, or the history it requires, is not available this tick.
 */
public class AvailabilityException extends VibrationSentinelException {

    private static final long serialVersionUID = 1L;

    public AvailabilityException(String message) {
        super(message);
    }

    public AvailabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
