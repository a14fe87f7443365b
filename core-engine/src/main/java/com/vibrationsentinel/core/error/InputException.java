package com.vibrationsentinel.core.error;

/**
 * Malformed or insufficient sample input.
 */
public class InputException extends VibrationSentinelException {

    private static final long serialVersionUID = 1L;

    public InputException(String message) {
        super(message);
    }

    public InputException(String message, Throwable cause) {
        super(message, cause);
    }
}
