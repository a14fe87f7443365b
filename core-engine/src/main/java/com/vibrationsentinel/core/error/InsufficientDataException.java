package com.vibrationsentinel.core.error;

/**
 * Raised when a sample stream cannot fill a complete analysis window.
 */
public class InsufficientDataException extends InputException {

    private static final long serialVersionUID = 1L;

    private final int available;
    private final int required;

    public InsufficientDataException(int available, int required) {
        super("Insufficient samples for a window: " + available + " available, " + required + " required");
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
