package com.vibrationsentinel.core.error;

/**
 * A numeric computation produced NaN or Inf.
 */
public class ComputationException extends VibrationSentinelException {

    private static final long serialVersionUID = 1L;

    public ComputationException(String message) {
        super(message);
    }

    public ComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
