package com.vibrationsentinel.core.signal;

import com.vibrationsentinel.core.error.InsufficientDataException;
import com.vibrationsentinel.core.model.RawSample;
import com.vibrationsentinel.core.model.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy, restartable sequence of windows over a {@link SampleStreamReader}.
 *
 * <p>
 * Only one window's worth of samples is buffered at a time, so arbitrarily
 * long streams are processed in bounded memory. Calling {@link #iterator()}
 * again re-opens the reader and starts over.
 * </p>
 */
public final class WindowSequence implements Iterable<Window> {

    private static final Logger LOG = LoggerFactory.getLogger(WindowSequence.class);

    private final SampleStreamReader reader;
    private final Windower windower;

    WindowSequence(SampleStreamReader reader, Windower windower) {
        this.reader = reader;
        this.windower = windower;
    }

    /**
     * @return a fresh iterator; {@link Iterator#hasNext()} throws
     *         {@link InsufficientDataException} if the stream ends before the
     *         first window is complete
     */
    @Override
    public Iterator<Window> iterator() {
        return new WindowIterator(reader.open());
    }

    private final class WindowIterator implements Iterator<Window> {

        private final Iterator<RawSample> source;
        private final Deque<RawSample> buffer = new ArrayDeque<>();
        private long sequence;
        private long consumed;
        private Window next;
        private boolean exhausted;

        WindowIterator(Iterator<RawSample> source) {
            this.source = source;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !exhausted) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public Window next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Window w = next;
            next = null;
            return w;
        }

        private Window advance() {
            int size = windower.getWindowSize();
            while (buffer.size() < size && source.hasNext()) {
                RawSample s = source.next();
                Windower.requireFinite(s.getAmplitude(), consumed);
                consumed++;
                buffer.addLast(s);
            }
            if (buffer.size() < size) {
                exhausted = true;
                if (sequence == 0) {
                    throw new InsufficientDataException(buffer.size(), size);
                }
                if (!buffer.isEmpty()) {
                    LOG.debug("Dropping trailing partial window of {} sample(s)", buffer.size());
                }
                return null;
            }

            double[] samples = new double[size];
            int i = 0;
            for (RawSample s : buffer) {
                samples[i++] = s.getAmplitude();
            }
            Window w = new Window(sequence++, buffer.peekFirst().getTimestamp(),
                    windower.getHopSize(), windower.getSampleRate(), samples);

            for (int h = 0; h < windower.getHopSize(); h++) {
                buffer.pollFirst();
            }
            return w;
        }
    }
}
