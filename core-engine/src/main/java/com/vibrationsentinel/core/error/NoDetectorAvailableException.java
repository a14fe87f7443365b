package com.vibrationsentinel.core.error;

/**
 * Every detector in the ensemble was unavailable for the current tick.
 */
public class NoDetectorAvailableException extends AvailabilityException {

    private static final long serialVersionUID = 1L;

    public NoDetectorAvailableException(String message) {
        super(message);
    }
}
