package com.vibrationsentinel.core.error;

/**
 * Normalization was invoked before {@code NormalizationStats} were loaded.
 */
public class UnfittedStatsException extends CalibrationException {

    private static final long serialVersionUID = 1L;

    public UnfittedStatsException(String message) {
        super(message);
    }
}
