package com.vibrationsentinel.core.signal;

import com.vibrationsentinel.core.config.PipelineConfig;
import com.vibrationsentinel.core.error.InputException;
import com.vibrationsentinel.core.error.InsufficientDataException;
import com.vibrationsentinel.core.model.Window;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Slices a sample stream into fixed-length, overlapping analysis windows.
 *
 * <p>
 * Three entry points share the same slicing rules:
 * </p>
 * <ul>
 * <li>{@link #windows(SampleStreamReader)}: lazy, restartable sequence over
 * an unbounded reader</li>
 * <li>{@link #slice(double[], Instant)}: eager slicing of a bounded
 * array</li>
 * <li>{@link #assembler()}: push-based assembly for streaming hosts</li>
 * </ul>
 *
 * <p>
 * A trailing partial window is always dropped: padding would bias the
 * spectral features.
 * </p>
 *
 * @since 1.0.0
 */
public final class Windower implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int windowSize;
    private final int hopSize;
    private final double sampleRate;

    /**
     * @param windowSize samples per window
     * @param hopSize    samples between successive window starts; in
     *                   {@code [1, windowSize]}
     * @param sampleRate sampling frequency in Hz
     * @throws IllegalArgumentException if any argument is out of range
     */
    public Windower(int windowSize, int hopSize, double sampleRate) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1, got: " + windowSize);
        }
        if (hopSize < 1 || hopSize > windowSize) {
            throw new IllegalArgumentException(
                    "hopSize must be in [1, " + windowSize + "], got: " + hopSize);
        }
        if (!(sampleRate > 0)) {
            throw new IllegalArgumentException("sampleRate must be > 0, got: " + sampleRate);
        }
        this.windowSize = windowSize;
        this.hopSize = hopSize;
        this.sampleRate = sampleRate;
    }

    public static Windower from(PipelineConfig.Windowing config) {
        Objects.requireNonNull(config, "Windowing config must not be null");
        return new Windower(config.getWindowSize(), config.getHopSize(), config.getSampleRate());
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int getHopSize() {
        return hopSize;
    }

    public double getSampleRate() {
        return sampleRate;
    }

    /**
     * @param reader sample source; must not be {@code null}
     * @return a lazy sequence; each iteration re-opens the reader
     */
    public WindowSequence windows(SampleStreamReader reader) {
        return new WindowSequence(Objects.requireNonNull(reader, "reader must not be null"), this);
    }

    /**
     * Slice a bounded signal. Sample timestamps are derived from
     * {@code start} and the sample rate.
     *
     * @param samples raw samples; must not be {@code null}
     * @param start   timestamp of the first sample
     * @return every complete window, in order
     * @throws InsufficientDataException if {@code samples} cannot fill one
     *                                   window
     * @throws InputException            if any sample is NaN or infinite
     */
    public List<Window> slice(double[] samples, Instant start) {
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(start, "start must not be null");
        if (samples.length < windowSize) {
            throw new InsufficientDataException(samples.length, windowSize);
        }
        for (int i = 0; i < samples.length; i++) {
            requireFinite(samples[i], i);
        }
        int count = (samples.length - windowSize) / hopSize + 1;
        List<Window> windows = new ArrayList<>(count);
        double[] buffer = new double[windowSize];
        for (int w = 0; w < count; w++) {
            int offset = w * hopSize;
            System.arraycopy(samples, offset, buffer, 0, windowSize);
            windows.add(new Window(w, start.plus(offsetDuration(offset)), hopSize, sampleRate, buffer));
        }
        return windows;
    }

    /**
     * @return a new, empty push-based assembler using this windower's geometry
     */
    public WindowAssembler assembler() {
        return new WindowAssembler(windowSize, hopSize, sampleRate);
    }

    Duration offsetDuration(long sampleOffset) {
        return Duration.ofNanos(Math.round(sampleOffset * 1_000_000_000.0 / sampleRate));
    }

    static void requireFinite(double amplitude, long position) {
        if (!Double.isFinite(amplitude)) {
            throw new InputException("Sample " + position + " is not finite: " + amplitude);
        }
    }

    @Override
    public String toString() {
        return "Windower{size=" + windowSize + ", hop=" + hopSize + ", rate=" + sampleRate + '}';
    }
}
