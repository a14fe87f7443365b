package com.vibrationsentinel.core.error;

/**
 * A sequence detector has fewer buffered feature vectors than it consumes.
 */
public class InsufficientHistoryException extends AvailabilityException {

    private static final long serialVersionUID = 1L;

    private final int buffered;
    private final int required;

    public InsufficientHistoryException(int buffered, int required) {
        super("Insufficient history: " + buffered + " feature vector(s) buffered, " + required + " required");
        this.buffered = buffered;
        this.required = required;
    }

    public int getBuffered() {
        return buffered;
    }

    public int getRequired() {
        return required;
    }
}
