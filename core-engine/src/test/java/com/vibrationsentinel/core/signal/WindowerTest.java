package com.vibrationsentinel.core.signal;

import com.vibrationsentinel.core.error.InputException;
import com.vibrationsentinel.core.error.InsufficientDataException;
import com.vibrationsentinel.core.model.RawSample;
import com.vibrationsentinel.core.model.Window;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Windower}, {@link WindowSequence} and
 * {@link WindowAssembler}.
 */
class WindowerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final Windower windower = new Windower(8, 4, 1000.0);

    @Test
    @DisplayName("Should slice overlapping windows and drop the trailing partial window")
    void shouldSliceAndDropTail() {
        List<Window> windows = windower.slice(ramp(22), T0);

        // starts at 0, 4, 8, 12; a window at 16 would need 24 samples
        assertThat(windows).hasSize(4);
        assertThat(windows.get(1).samples()).containsExactly(4, 5, 6, 7, 8, 9, 10, 11);
        assertThat(windows.get(3).getSequence()).isEqualTo(3);
        assertThat(windows.get(1).getStart()).isEqualTo(T0.plus(Duration.ofMillis(4)));
        assertThat(windows.get(0).getOverlap()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should produce exactly one window from exactly one window of samples")
    void shouldSliceExactlyOneWindow() {
        assertThat(windower.slice(ramp(8), T0)).hasSize(1);
    }

    @Test
    @DisplayName("Should raise InsufficientDataException when one window cannot be filled")
    void shouldRejectShortInput() {
        assertThatThrownBy(() -> windower.slice(ramp(7), T0))
                .isInstanceOf(InsufficientDataException.class)
                .isInstanceOf(InputException.class);
    }

    @Test
    @DisplayName("Should reject non-finite samples at the stream boundary")
    void shouldRejectNonFinite() {
        double[] x = ramp(16);
        x[5] = Double.NaN;
        assertThatThrownBy(() -> windower.slice(x, T0)).isInstanceOf(InputException.class);
    }

    @Test
    @DisplayName("Emitted windows should not share sample storage")
    void windowsShouldBeIndependentCopies() {
        List<Window> windows = windower.slice(ramp(12), T0);
        double[] first = windows.get(0).samples();
        first[4] = -1.0;

        assertThat(windows.get(0).samples()[4]).isEqualTo(4.0);
        assertThat(windows.get(1).samples()[0]).isEqualTo(4.0);
    }

    @Test
    @DisplayName("Lazy sequence should match eager slicing and restart on every iteration")
    void lazySequenceShouldBeRestartable() {
        AtomicInteger opens = new AtomicInteger();
        SampleStreamReader reader = () -> {
            opens.incrementAndGet();
            return samples(ramp(22)).iterator();
        };
        WindowSequence sequence = windower.windows(reader);

        List<Window> first = collect(sequence);
        List<Window> second = collect(sequence);

        assertThat(opens.get()).isEqualTo(2);
        assertThat(first).hasSize(4).isEqualTo(second);
        assertThat(first).isEqualTo(windower.slice(ramp(22), T0));
    }

    @Test
    @DisplayName("Lazy sequence should raise InsufficientDataException when the stream is too short")
    void lazySequenceShouldRejectShortStream() {
        Iterator<Window> it = windower.windows(() -> samples(ramp(5)).iterator()).iterator();
        assertThatThrownBy(it::hasNext).isInstanceOf(InsufficientDataException.class);
    }

    @Test
    @DisplayName("Assembler should emit the first window after windowSize samples, then every hop")
    void assemblerShouldEmitEveryHop() {
        WindowAssembler assembler = windower.assembler();
        List<Integer> emittedAt = new ArrayList<>();
        List<Window> windows = new ArrayList<>();
        List<RawSample> stream = samples(ramp(20));
        for (int i = 0; i < stream.size(); i++) {
            Optional<Window> w = assembler.offer(stream.get(i));
            if (w.isPresent()) {
                emittedAt.add(i + 1);
                windows.add(w.get());
            }
        }

        assertThat(emittedAt).containsExactly(8, 12, 16, 20);
        assertThat(windows).isEqualTo(windower.slice(ramp(20), T0));
        assertThat(assembler.emitted()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should reject a hop larger than the window")
    void shouldRejectInvalidGeometry() {
        assertThatThrownBy(() -> new Windower(8, 9, 1000.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Windower(8, 4, 0.0)).isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static double[] ramp(int n) {
        double[] x = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = i;
        }
        return x;
    }

    private static List<RawSample> samples(double[] x) {
        List<RawSample> out = new ArrayList<>();
        for (int i = 0; i < x.length; i++) {
            out.add(new RawSample(T0.plus(Duration.ofMillis(i)), x[i]));
        }
        return out;
    }

    private static List<Window> collect(Iterable<Window> windows) {
        List<Window> out = new ArrayList<>();
        windows.forEach(out::add);
        return out;
    }
}
