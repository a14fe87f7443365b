package com.vibrationsentinel.core.pipeline;

import com.vibrationsentinel.core.config.PipelineConfig;
import com.vibrationsentinel.core.detection.AnomalyDetector;
import com.vibrationsentinel.core.detection.SequenceModel;
import com.vibrationsentinel.core.detection.TemporalDetector;
import com.vibrationsentinel.core.ensemble.EnsembleScorer;
import com.vibrationsentinel.core.ensemble.FallbackPolicy;
import com.vibrationsentinel.core.error.InsufficientHistoryException;
import com.vibrationsentinel.core.error.NoDetectorAvailableException;
import com.vibrationsentinel.core.error.UnfittedStatsException;
import com.vibrationsentinel.core.model.AlertLevel;
import com.vibrationsentinel.core.model.EnsembleResult;
import com.vibrationsentinel.core.model.FeatureSchema;
import com.vibrationsentinel.core.model.Feedback;
import com.vibrationsentinel.core.model.RawSample;
import com.vibrationsentinel.core.model.Window;
import com.vibrationsentinel.core.normalization.NormalizationStats;
import com.vibrationsentinel.core.normalization.Normalizer;
import com.vibrationsentinel.core.support.MutableClock;
import com.vibrationsentinel.core.support.Signals;
import com.vibrationsentinel.core.support.StubDetector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AssetPipeline}.
 */
class AssetPipelineTest {

    private static final String ASSET = "pump-1";
    private static final int WINDOW = 256;
    private static final int HOP = 128;
    private static final double RATE = 10_000.0;

    private ExecutorService executor;
    private MutableClock clock;
    private PipelineConfig config;

    @BeforeEach
    void setUp() {
        executor = EnsembleScorer.newDetectorExecutor(4);
        clock = new MutableClock(Signals.T0);
        config = new PipelineConfig();
        config.getWindowing().setWindowSize(WINDOW);
        config.getWindowing().setHopSize(HOP);
        config.getWindowing().setSampleRate(RATE);
        config.getDetectors().setSequenceLength(3);
        config.getRul().setMinPoints(3);
        config.getEnsemble().setDetectorTimeoutMs(1_000);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    // ---------------------------------------------------------------
    // Streaming
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should emit one classified result per completed window")
    void streamProducesResults() {
        AssetPipeline pipeline = new AssetPipeline(ASSET, components(
                StubDetector.fixed("reconstruction", 0.1), StubDetector.fixed("isolation", 0.2)));

        List<PipelineOutcome> outcomes = feed(pipeline, sine(WINDOW + 3 * HOP), 0);

        assertThat(outcomes).hasSize(4);
        for (PipelineOutcome outcome : outcomes) {
            EnsembleResult result = outcome.result().orElseThrow();
            assertThat(result.getAssetId()).isEqualTo(ASSET);
            assertThat(result.getCompositeScore()).isCloseTo(0.1 / 0.7, within(1e-12));
            assertThat(result.getAlertLevel()).isEqualTo(AlertLevel.NORMAL);
            assertThat(outcome.driftEvent()).isEmpty();
        }
        assertThat(outcomes.get(0).rulEstimate().orElseThrow().isAvailable()).isFalse();
        assertThat(outcomes.get(3).rulEstimate().orElseThrow().getReason()).contains("no degradation trend");
    }

    @Test
    @DisplayName("Temporal detector should join once enough history is buffered")
    void temporalJoinsAfterHistory() {
        TemporalDetector temporal = new TemporalDetector(constantModel(3, 0.9));
        AssetPipeline pipeline = new AssetPipeline(ASSET, components(
                StubDetector.fixed("reconstruction", 0.1), StubDetector.fixed("isolation", 0.1), temporal));

        List<PipelineOutcome> outcomes = feed(pipeline, sine(WINDOW + 3 * HOP), 0);

        assertThat(outcomes.get(0).result().orElseThrow().getContributors())
                .containsExactly("reconstruction", "isolation");
        assertThat(outcomes.get(1).result().orElseThrow().isDegraded()).isTrue();
        EnsembleResult third = outcomes.get(2).result().orElseThrow();
        assertThat(third.getContributors()).contains("temporal");
        assertThat(third.getCompositeScore()).isCloseTo(0.4 * 0.1 + 0.3 * 0.1 + 0.3 * 0.9, within(1e-12));
        assertThat(pipeline.history()).hasSize(3);
    }

    @Test
    @DisplayName("Window whose features overflow should be dropped without failing the pipeline")
    void overflowingWindowIsDropped() {
        AssetPipeline pipeline = new AssetPipeline(ASSET, components(StubDetector.fixed("reconstruction", 0.1)));
        double[] huge = new double[WINDOW];
        Arrays.fill(huge, 1e200);

        PipelineOutcome outcome = pipeline.process(new Window(0, Signals.T0, HOP, RATE, huge));

        assertThat(outcome.isDropped()).isTrue();
        assertThat(outcome.result()).isEmpty();
        assertThat(pipeline.isFailed()).isFalse();
        assertThat(pipeline.process(new Window(1, Signals.T0, HOP, RATE, sine(WINDOW))).result()).isPresent();
    }

    // ---------------------------------------------------------------
    // Failures
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Missing normalization statistics should fail the pipeline permanently")
    void unfittedNormalizerFailsPipeline() {
        PipelineComponents components = PipelineComponents.builder()
                .config(config)
                .normalizer(new Normalizer())
                .detectors(List.of(StubDetector.fixed("reconstruction", 0.1)))
                .executor(executor)
                .clock(clock)
                .build();
        AssetPipeline pipeline = new AssetPipeline(ASSET, components);

        assertThatThrownBy(() -> pipeline.process(new Window(0, Signals.T0, HOP, RATE, sine(WINDOW))))
                .isInstanceOf(UnfittedStatsException.class);
        assertThat(pipeline.isFailed()).isTrue();
        assertThatThrownBy(() -> pipeline.offer(new RawSample(Signals.T0, 0.0)))
                .isInstanceOf(UnfittedStatsException.class);
    }

    @Test
    @DisplayName("With no detector available, SKIP emits nothing for the window")
    void unavailableSkip() {
        config.getEnsemble().setUnavailableFallback(FallbackPolicy.SKIP);
        AssetPipeline pipeline = new AssetPipeline(ASSET, components(flaky()));

        assertThat(pipeline.process(window(0)).result()).isPresent();
        PipelineOutcome second = pipeline.process(window(1));

        assertThat(second.result()).isEmpty();
        assertThat(second.isDropped()).isFalse();
    }

    @Test
    @DisplayName("With no detector available, REUSE_STALE re-emits the last result marked stale")
    void unavailableReuseStale() {
        config.getEnsemble().setUnavailableFallback(FallbackPolicy.REUSE_STALE);
        AssetPipeline pipeline = new AssetPipeline(ASSET, components(flaky()));

        EnsembleResult first = pipeline.process(window(0)).result().orElseThrow();
        EnsembleResult second = pipeline.process(window(1)).result().orElseThrow();

        assertThat(second.isStale()).isTrue();
        assertThat(second.getResultId()).isNotEqualTo(first.getResultId());
        assertThat(second.getCompositeScore()).isEqualTo(first.getCompositeScore());
        assertThat(second.getWindowStart()).isEqualTo(window(1).getStart());
    }

    @Test
    @DisplayName("With no detector available, FAIL propagates without failing the pipeline")
    void unavailableFail() {
        config.getEnsemble().setUnavailableFallback(FallbackPolicy.FAIL);
        AssetPipeline pipeline = new AssetPipeline(ASSET, components(flaky()));
        pipeline.process(window(0));

        assertThatThrownBy(() -> pipeline.process(window(1))).isInstanceOf(NoDetectorAvailableException.class);
        assertThat(pipeline.isFailed()).isFalse();
    }

    // ---------------------------------------------------------------
    // Feedback and state
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Feedback quoting an emitted result should be recorded")
    void feedbackIsJoined() {
        AssetPipeline pipeline = new AssetPipeline(ASSET, components(StubDetector.fixed("reconstruction", 0.6)));
        EnsembleResult result = pipeline.process(window(0)).result().orElseThrow();

        pipeline.onFeedback(new Feedback("fb-1", ASSET, result.getResultId(), true, clock.instant()));

        assertThat(pipeline.snapshot().getThreshold().getFeedback()).hasSize(1);
        assertThat(pipeline.snapshot().getThreshold().getFeedback().get(0).getScore()).isEqualTo(0.6);
    }

    @Test
    @DisplayName("A restored pipeline should continue the stream exactly where the snapshot left it")
    void snapshotRestoreContinuesStream() {
        PipelineComponents components = components(StubDetector.fixed("reconstruction", 0.1));
        AssetPipeline original = new AssetPipeline(ASSET, components);
        double[] signal = sine(WINDOW + 2 * HOP);
        int cut = WINDOW + 50;
        feed(original, Arrays.copyOfRange(signal, 0, cut), 0);

        AssetState state = original.snapshot();
        AssetPipeline restored = AssetPipeline.restore(components, state);
        double[] rest = Arrays.copyOfRange(signal, cut, signal.length);
        List<PipelineOutcome> fromOriginal = feed(original, rest, cut);
        List<PipelineOutcome> fromRestored = feed(restored, rest, cut);

        assertThat(fromRestored).hasSameSizeAs(fromOriginal).hasSize(2);
        assertThat(restored.history()).hasSameSizeAs(original.history());
        assertThat(restored.currentCuts()).isEqualTo(original.currentCuts());
        assertThat(state.getAssembler().buffered()).isEqualTo(WINDOW);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private PipelineComponents components(AnomalyDetector... detectors) {
        List<String> names = FeatureSchema.DEFAULT.names();
        double[] mean = new double[names.size()];
        double[] std = new double[names.size()];
        Arrays.fill(std, 1.0);
        return PipelineComponents.builder()
                .config(config)
                .normalizer(new Normalizer(new NormalizationStats(names, mean, std)))
                .detectors(List.of(detectors))
                .executor(executor)
                .clock(clock)
                .build();
    }

    private static double[] sine(int n) {
        return Signals.sine(n, RATE, 120.0, 1.0);
    }

    private static Window window(long sequence) {
        Instant start = Signals.T0.plusNanos(Math.round(sequence * HOP * 1e9 / RATE));
        return new Window(sequence, start, HOP, RATE, sine(WINDOW));
    }

    private static List<PipelineOutcome> feed(AssetPipeline pipeline, double[] samples, long offset) {
        List<PipelineOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < samples.length; i++) {
            Instant t = Signals.T0.plusNanos(Math.round((offset + i) * 1e9 / RATE));
            Optional<PipelineOutcome> outcome = pipeline.offer(new RawSample(t, samples[i]));
            outcome.ifPresent(outcomes::add);
        }
        return outcomes;
    }

    /** Scores once, then reports insufficient history forever. */
    private static StubDetector flaky() {
        AtomicInteger calls = new AtomicInteger();
        return StubDetector.scoring("reconstruction", in -> {
            if (calls.getAndIncrement() == 0) {
                return 0.5;
            }
            throw new InsufficientHistoryException(0, 1);
        });
    }

    private static SequenceModel constantModel(int length, double output) {
        return new SequenceModel() {
            @Override
            public int sequenceLength() {
                return length;
            }

            @Override
            public double predict(double[][] sequence) {
                return output;
            }
        };
    }
}
