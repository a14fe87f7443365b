package com.vibrationsentinel.core.signal;

import com.vibrationsentinel.core.model.RawSample;

import java.util.Iterator;

/**
 * Ordered source of raw samples for one sensor channel.
 *
 * <p>
 * Each call to {@link #open()} starts reading from the beginning of the
 * stream, which is what makes a {@link WindowSequence} restartable.
 * </p>
 */
@FunctionalInterface
public interface SampleStreamReader {

    /**
     * @return a fresh iterator over the stream in timestamp order
     */
    Iterator<RawSample> open();
}
