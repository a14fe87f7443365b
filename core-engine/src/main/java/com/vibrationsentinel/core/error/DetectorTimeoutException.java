package com.vibrationsentinel.core.error;

import java.time.Duration;

/**
 * A detector did not answer within its configured timeout.
 */
public class DetectorTimeoutException extends AvailabilityException {

    private static final long serialVersionUID = 1L;

    public DetectorTimeoutException(String detector, Duration timeout) {
        super("Detector '" + detector + "' timed out after " + timeout.toMillis() + " ms");
    }
}
