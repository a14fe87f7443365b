package com.vibrationsentinel.core.signal;

import com.vibrationsentinel.core.model.RawSample;
import com.vibrationsentinel.core.model.Window;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;

/**
 * Push-based window assembly for hosts that receive one sample at a time.
 *
 * <p>
 * Emits the first window once {@code windowSize} samples have arrived and
 * then one window every {@code hopSize} samples.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * This class is <strong>stateful</strong> and {@link Serializable} so that a
 * streaming host can keep one instance per asset in checkpointed state. It
 * is not thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowAssembler implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int windowSize;
    private final int hopSize;
    private final double sampleRate;

    private final ArrayDeque<RawSample> buffer = new ArrayDeque<>();
    private long sequence;
    private long received;
    private int untilNext;

    WindowAssembler(int windowSize, int hopSize, double sampleRate) {
        this.windowSize = windowSize;
        this.hopSize = hopSize;
        this.sampleRate = sampleRate;
        this.untilNext = windowSize;
    }

    /**
     * @param sample next sample of the stream; must not be {@code null}
     * @return a complete window if this sample completed one
     * @throws com.vibrationsentinel.core.error.InputException if the amplitude
     *                                                         is not finite
     */
    public Optional<Window> offer(RawSample sample) {
        Objects.requireNonNull(sample, "sample must not be null");
        Windower.requireFinite(sample.getAmplitude(), received);
        received++;

        buffer.addLast(sample);
        if (buffer.size() > windowSize) {
            buffer.pollFirst();
        }
        if (--untilNext > 0) {
            return Optional.empty();
        }
        untilNext = hopSize;

        double[] samples = new double[windowSize];
        int i = 0;
        for (RawSample s : buffer) {
            samples[i++] = s.getAmplitude();
        }
        return Optional.of(new Window(sequence++, buffer.peekFirst().getTimestamp(),
                hopSize, sampleRate, samples));
    }

    /**
     * @return an independent copy carrying the same buffer and counters
     */
    public WindowAssembler copy() {
        WindowAssembler c = new WindowAssembler(windowSize, hopSize, sampleRate);
        c.buffer.addAll(buffer);
        c.sequence = sequence;
        c.received = received;
        c.untilNext = untilNext;
        return c;
    }

    /**
     * @return number of samples buffered towards the next window
     */
    public int buffered() {
        return buffer.size();
    }

    /**
     * @return number of windows emitted so far
     */
    public long emitted() {
        return sequence;
    }
}
