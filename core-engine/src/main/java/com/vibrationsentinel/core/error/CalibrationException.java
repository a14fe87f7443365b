package com.vibrationsentinel.core.error;

/**
 * Scoring was attempted before the required statistics or thresholds were
 * fit. Fatal to the asset's pipeline.
 */
public class CalibrationException extends VibrationSentinelException {

    private static final long serialVersionUID = 1L;

    public CalibrationException(String message) {
        super(message);
    }

    public CalibrationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
