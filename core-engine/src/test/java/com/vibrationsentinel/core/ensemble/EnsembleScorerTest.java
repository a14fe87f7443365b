package com.vibrationsentinel.core.ensemble;

import com.vibrationsentinel.core.detection.AnomalyDetector;
import com.vibrationsentinel.core.detection.DetectorInput;
import com.vibrationsentinel.core.error.ComputationException;
import com.vibrationsentinel.core.error.DetectorTimeoutException;
import com.vibrationsentinel.core.error.InsufficientHistoryException;
import com.vibrationsentinel.core.error.NoDetectorAvailableException;
import com.vibrationsentinel.core.model.AlertLevel;
import com.vibrationsentinel.core.model.DetectorScore;
import com.vibrationsentinel.core.model.EnsembleResult;
import com.vibrationsentinel.core.support.MutableClock;
import com.vibrationsentinel.core.support.Signals;
import com.vibrationsentinel.core.support.StubDetector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link EnsembleScorer}.
 */
class EnsembleScorerTest {

    private static final String RECON = "reconstruction";
    private static final String ISO = "isolation";
    private static final String TEMPORAL = "temporal";

    private ExecutorService executor;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        executor = EnsembleScorer.newDetectorExecutor(3);
        clock = new MutableClock(Signals.T0);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    // ---------------------------------------------------------------
    // Weighting
    // ---------------------------------------------------------------

    @ParameterizedTest(name = "availability mask {0}")
    @ValueSource(ints = {1, 2, 3, 4, 5, 6, 7})
    @DisplayName("Applied weights should sum to 1 over every non-empty subset of detectors")
    void weightsSumToOneForEverySubset(int mask) {
        List<AnomalyDetector> detectors = new ArrayList<>();
        String[] names = {RECON, ISO, TEMPORAL};
        for (int i = 0; i < names.length; i++) {
            detectors.add((mask & (1 << i)) != 0
                    ? StubDetector.fixed(names[i], 0.5)
                    : StubDetector.offline(names[i]));
        }
        EnsembleScorer scorer = scorer(detectors, FallbackPolicy.SKIP);

        EnsembleResult result = score(scorer, new HashMap<>());

        double sum = result.getAppliedWeights().values().stream().mapToDouble(Double::doubleValue).sum();
        assertThat(sum).isCloseTo(1.0, within(1e-12));
        assertThat(result.getAppliedWeights()).hasSize(Integer.bitCount(mask));
        assertThat(result.getCompositeScore()).isCloseTo(0.5, within(1e-12));
    }

    @Test
    @DisplayName("Healthy detector scores should produce NORMAL results")
    void healthyScoresStayNormal() {
        EnsembleScorer scorer = scorer(List.of(
                StubDetector.scoring(RECON, in -> 0.1 + 0.01 * (in.current().getWindowSequence() % 10)),
                StubDetector.fixed(ISO, 0.15),
                StubDetector.fixed(TEMPORAL, 0.2)), FallbackPolicy.SKIP);

        for (int i = 0; i < 10; i++) {
            EnsembleResult result = scorer.score("pump-1", DetectorInput.of(Signals.constantVector(0.0, i)),
                    AlertCuts.BOOTSTRAP, new HashMap<>());
            assertThat(result.getCompositeScore()).isLessThan(0.3);
            assertThat(result.getAlertLevel()).isEqualTo(AlertLevel.NORMAL);
            assertThat(result.isDegraded()).isFalse();
        }
    }

    @Test
    @DisplayName("Temporal detector without history should be excluded and weights renormalized")
    void temporalWithoutHistoryIsExcluded() {
        EnsembleScorer scorer = scorer(List.of(
                StubDetector.fixed(RECON, 0.7),
                StubDetector.fixed(ISO, 0.0),
                StubDetector.failing(TEMPORAL, new InsufficientHistoryException(3, 100))), FallbackPolicy.FAIL);

        EnsembleResult result = score(scorer, new HashMap<>());

        assertThat(result.getAppliedWeights().get(RECON)).isCloseTo(4.0 / 7.0, within(1e-12));
        assertThat(result.getAppliedWeights().get(ISO)).isCloseTo(3.0 / 7.0, within(1e-12));
        assertThat(result.getAppliedWeights()).doesNotContainKey(TEMPORAL);
        assertThat(result.scoreOf(TEMPORAL).isAvailable()).isFalse();
        assertThat(result.getCompositeScore()).isCloseTo(0.4, within(1e-12));
        assertThat(result.getAlertLevel()).isEqualTo(AlertLevel.WARNING);
        assertThat(result.isDegraded()).isTrue();
    }

    @Test
    @DisplayName("Replaced weights should apply to the next tick")
    void setWeightsAppliesToNextTick() {
        EnsembleScorer scorer = scorer(List.of(
                StubDetector.fixed(RECON, 1.0), StubDetector.fixed(ISO, 0.0)), FallbackPolicy.SKIP);

        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put(RECON, 1.0);
        weights.put(ISO, 3.0);
        scorer.setWeights(weights);

        assertThat(score(scorer, new HashMap<>()).getCompositeScore()).isCloseTo(0.25, within(1e-12));
        assertThat(scorer.getWeights()).containsEntry(ISO, 3.0);
    }

    @Test
    @DisplayName("Should reject negative or all-zero weights")
    void shouldRejectInvalidWeights() {
        EnsembleScorer scorer = scorer(List.of(StubDetector.fixed(RECON, 0.1)), FallbackPolicy.SKIP);

        assertThatThrownBy(() -> scorer.setWeights(Map.of(RECON, -1.0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> scorer.setWeights(Map.of(RECON, 0.0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(scorer.getWeights()).containsEntry(RECON, 0.4);
    }

    // ---------------------------------------------------------------
    // Failure handling
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Slow detector should be skipped under SKIP")
    void timeoutSkipped() {
        EnsembleScorer scorer = scorer(List.of(
                StubDetector.fixed(RECON, 0.2),
                StubDetector.slow(ISO, 0.9, 2_000)), FallbackPolicy.SKIP);

        EnsembleResult result = score(scorer, new HashMap<>());

        assertThat(result.getContributors()).containsExactly(RECON);
        assertThat(result.scoreOf(ISO).getReason()).contains("timed out");
        assertThat(result.getCompositeScore()).isCloseTo(0.2, within(1e-12));
    }

    @Test
    @DisplayName("Slow detector should reuse its last good score under REUSE_STALE")
    void timeoutReusesStale() {
        EnsembleScorer scorer = scorer(List.of(
                StubDetector.fixed(RECON, 0.2),
                StubDetector.slow(ISO, 0.9, 2_000)), FallbackPolicy.REUSE_STALE);
        Map<String, Double> lastGood = new HashMap<>();
        lastGood.put(ISO, 0.6);

        EnsembleResult result = score(scorer, lastGood);

        DetectorScore iso = result.scoreOf(ISO);
        assertThat(iso.isAvailable()).isTrue();
        assertThat(iso.isStale()).isTrue();
        assertThat(iso.getScore()).isEqualTo(0.6);
        assertThat(result.getCompositeScore()).isCloseTo((0.4 * 0.2 + 0.3 * 0.6) / 0.7, within(1e-12));
        assertThat(lastGood).containsEntry(RECON, 0.2);
    }

    @Test
    @DisplayName("REUSE_STALE without a previous score degrades to skipping")
    void reuseStaleWithoutHistorySkips() {
        EnsembleScorer scorer = scorer(List.of(
                StubDetector.fixed(RECON, 0.2),
                StubDetector.failing(ISO, new ComputationException("boom"))), FallbackPolicy.REUSE_STALE);

        EnsembleResult result = score(scorer, new HashMap<>());

        assertThat(result.getContributors()).containsExactly(RECON);
    }

    @Test
    @DisplayName("Slow detector should fail the tick under FAIL")
    void timeoutFails() {
        EnsembleScorer scorer = scorer(List.of(
                StubDetector.fixed(RECON, 0.2),
                StubDetector.slow(ISO, 0.9, 2_000)), FallbackPolicy.FAIL);

        assertThatThrownBy(() -> score(scorer, new HashMap<>()))
                .isInstanceOf(DetectorTimeoutException.class);
    }

    @Test
    @DisplayName("Out-of-range detector output counts as a failure")
    void outOfRangeScoreIsFailure() {
        EnsembleScorer scorer = scorer(List.of(
                StubDetector.fixed(RECON, 0.2),
                StubDetector.fixed(ISO, 1.5)), FallbackPolicy.FAIL);

        assertThatThrownBy(() -> score(scorer, new HashMap<>()))
                .isInstanceOf(ComputationException.class);
    }

    @Test
    @DisplayName("Should raise when no detector produces a score")
    void noDetectorAvailable() {
        EnsembleScorer scorer = scorer(List.of(
                StubDetector.offline(RECON),
                StubDetector.failing(ISO, new InsufficientHistoryException(0, 1))), FallbackPolicy.SKIP);

        assertThatThrownBy(() -> score(scorer, new HashMap<>()))
                .isInstanceOf(NoDetectorAvailableException.class);
    }

    @Test
    @DisplayName("Health reflects how many detectors are loaded")
    void healthReflectsAvailability() {
        assertThat(scorer(List.of(StubDetector.fixed(RECON, 0.1), StubDetector.fixed(ISO, 0.1)),
                FallbackPolicy.SKIP).health()).isEqualTo(EnsembleHealth.HEALTHY);
        assertThat(scorer(List.of(StubDetector.fixed(RECON, 0.1), StubDetector.offline(ISO)),
                FallbackPolicy.SKIP).health()).isEqualTo(EnsembleHealth.DEGRADED);
        assertThat(scorer(List.of(StubDetector.offline(RECON)),
                FallbackPolicy.SKIP).health()).isEqualTo(EnsembleHealth.UNHEALTHY);
    }

    @Test
    @DisplayName("Offline detectors are never called")
    void offlineDetectorsAreNotCalled() {
        StubDetector offline = StubDetector.offline(ISO);
        EnsembleScorer scorer = scorer(List.of(StubDetector.fixed(RECON, 0.1), offline), FallbackPolicy.SKIP);

        score(scorer, new HashMap<>());

        assertThat(offline.calls()).isZero();
    }

    @Test
    @DisplayName("Should reject duplicate detector names")
    void shouldRejectDuplicateNames() {
        assertThatThrownBy(() -> scorer(List.of(StubDetector.fixed(RECON, 0.1), StubDetector.fixed(RECON, 0.2)),
                FallbackPolicy.SKIP))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(RECON);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private EnsembleScorer scorer(List<AnomalyDetector> detectors, FallbackPolicy fallback) {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put(RECON, 0.4);
        weights.put(ISO, 0.3);
        weights.put(TEMPORAL, 0.3);
        return new EnsembleScorer(detectors, new EnsembleWeights(weights), executor,
                Duration.ofMillis(200), fallback, clock);
    }

    private static EnsembleResult score(EnsembleScorer scorer, Map<String, Double> lastGood) {
        return scorer.score("pump-1", DetectorInput.of(Signals.constantVector(0.0, 0)), AlertCuts.BOOTSTRAP,
                lastGood);
    }
}
