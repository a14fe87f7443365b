package com.vibrationsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable, fixed-length slice of a vibration sample stream.
 *
 * <p>
 * The sample array is copied on construction and on every call to
 * {@link #samples()}, so windows never share mutable state with the stream
 * they were cut from or with each other.
 * </p>
 *
 * @since 1.0.0
 */
public final class Window implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long sequence;
    private final Instant start;
    private final int hopSize;
    private final double sampleRate;
    private final double[] samples;

    /**
     * @param sequence   zero-based position of this window in its stream
     * @param start      timestamp of the first sample; must not be {@code null}
     * @param hopSize    samples between successive window starts (stride)
     * @param sampleRate sampling frequency in Hz
     * @param samples    window samples; copied
     * @throws IllegalArgumentException if {@code samples} is empty,
     *                                  {@code hopSize < 1} or
     *                                  {@code sampleRate <= 0}
     */
    public Window(long sequence, Instant start, int hopSize, double sampleRate, double[] samples) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(samples, "samples must not be null");
        if (samples.length == 0) {
            throw new IllegalArgumentException("Window must contain at least one sample");
        }
        if (hopSize < 1) {
            throw new IllegalArgumentException("hopSize must be >= 1, got: " + hopSize);
        }
        if (!(sampleRate > 0)) {
            throw new IllegalArgumentException("sampleRate must be > 0, got: " + sampleRate);
        }
        this.sequence = sequence;
        this.hopSize = hopSize;
        this.sampleRate = sampleRate;
        this.samples = samples.clone();
    }

    public long getSequence() {
        return sequence;
    }

    public Instant getStart() {
        return start;
    }

    public int getHopSize() {
        return hopSize;
    }

    /**
     * @return number of samples shared with the next window
     */
    public int getOverlap() {
        return Math.max(0, samples.length - hopSize);
    }

    public double getSampleRate() {
        return sampleRate;
    }

    public int size() {
        return samples.length;
    }

    /**
     * @return a copy of the window samples
     */
    public double[] samples() {
        return samples.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Window that))
            return false;
        return sequence == that.sequence
                && hopSize == that.hopSize
                && Double.compare(sampleRate, that.sampleRate) == 0
                && start.equals(that.start)
                && Arrays.equals(samples, that.samples);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequence, start, hopSize, sampleRate) * 31 + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "Window{sequence=" + sequence + ", start=" + start + ", size=" + samples.length
                + ", hop=" + hopSize + '}';
    }
}
