package com.vibrationsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single vibration reading from one sensor channel.
 *
 * @since 1.0.0
 */
public final class RawSample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double amplitude;

    /**
     * @param timestamp acquisition time; must not be {@code null}
     * @param amplitude measured amplitude
     */
    public RawSample(Instant timestamp, double amplitude) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.amplitude = amplitude;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getAmplitude() {
        return amplitude;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RawSample that))
            return false;
        return Double.compare(amplitude, that.amplitude) == 0
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, amplitude);
    }

    @Override
    public String toString() {
        return "RawSample{" + timestamp + ", " + amplitude + '}';
    }
}
