package com.vibrationsentinel.core.ensemble;

import com.vibrationsentinel.core.config.PipelineConfig;
import com.vibrationsentinel.core.detection.AnomalyDetector;
import com.vibrationsentinel.core.detection.DetectorInput;
import com.vibrationsentinel.core.error.AvailabilityException;
import com.vibrationsentinel.core.error.ComputationException;
import com.vibrationsentinel.core.error.DetectorTimeoutException;
import com.vibrationsentinel.core.error.NoDetectorAvailableException;
import com.vibrationsentinel.core.error.VibrationSentinelException;
import com.vibrationsentinel.core.model.AlertLevel;
import com.vibrationsentinel.core.model.DetectorScore;
import com.vibrationsentinel.core.model.EnsembleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Combines the scores of every available detector into one composite score
 * and classifies it against the supplied {@link AlertCuts}.
 *
 * <h3>Per tick</h3>
 * <ol>
 * <li>Every available detector is called concurrently on the executor.</li>
 * <li>All calls share one deadline of {@code detectorTimeout}. A detector
 * that times out or fails is handled by the detector {@link FallbackPolicy};
 * a detector that reports itself unable to score (for example while its
 * history fills) is simply unavailable.</li>
 * <li>Weights are renormalized over the contributing subset and the
 * composite is {@code sum(w_i * score_i)}.</li>
 * </ol>
 *
 * <h3>Thread safety</h3>
 * <p>
 * The scorer holds no per-asset state: the caller owns the map of last good
 * scores used by {@link FallbackPolicy#REUSE_STALE}. Weights may be replaced
 * at any time with {@link #setWeights(Map)}; each tick uses one consistent
 * snapshot.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnsembleScorer {

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleScorer.class);

    private final List<AnomalyDetector> detectors;
    private final ExecutorService executor;
    private final Duration detectorTimeout;
    private final FallbackPolicy fallback;
    private final Clock clock;
    private volatile EnsembleWeights weights;

    public EnsembleScorer(List<AnomalyDetector> detectors, EnsembleWeights weights, ExecutorService executor,
            Duration detectorTimeout, FallbackPolicy fallback, Clock clock) {
        Objects.requireNonNull(detectors, "detectors must not be null");
        if (detectors.isEmpty()) {
            throw new IllegalArgumentException("At least one detector is required");
        }
        Set<String> names = new HashSet<>();
        for (AnomalyDetector d : detectors) {
            if (!names.add(d.name())) {
                throw new IllegalArgumentException("Duplicate detector name: " + d.name());
            }
        }
        this.detectors = Collections.unmodifiableList(new ArrayList<>(detectors));
        this.weights = Objects.requireNonNull(weights, "weights must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.detectorTimeout = Objects.requireNonNull(detectorTimeout, "detectorTimeout must not be null");
        this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        for (String name : names) {
            if (weights.weightOf(name) == 0.0) {
                LOG.warn("Detector '{}' has no positive weight and only contributes when all others are silent", name);
            }
        }
    }

    public static EnsembleScorer from(List<AnomalyDetector> detectors, PipelineConfig.Ensemble config,
            ExecutorService executor) {
        Objects.requireNonNull(config, "Ensemble config must not be null");
        return new EnsembleScorer(detectors, new EnsembleWeights(config.weightMap()), executor,
                Duration.ofMillis(config.getDetectorTimeoutMs()), config.getDetectorFallback(),
                Clock.systemUTC());
    }

    /**
     * @param threads pool size; one per detector is enough for a single asset
     * @return a fixed pool of daemon threads named {@code detector-N}
     */
    public static ExecutorService newDetectorExecutor(int threads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "detector-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }

    // ---------------------------------------------------------------
    // Configuration
    // ---------------------------------------------------------------

    /**
     * Replace the detector weights used by subsequent ticks.
     *
     * @throws IllegalArgumentException if the weights are invalid
     */
    public void setWeights(Map<String, Double> newWeights) {
        EnsembleWeights replacement = new EnsembleWeights(newWeights);
        this.weights = replacement;
        LOG.info("Ensemble weights updated to {}", replacement.asMap());
    }

    public Map<String, Double> getWeights() {
        return weights.asMap();
    }

    public List<AnomalyDetector> getDetectors() {
        return detectors;
    }

    /**
     * @return readiness derived from each detector's
     *         {@link AnomalyDetector#isAvailable()}
     */
    public EnsembleHealth health() {
        int available = 0;
        for (AnomalyDetector d : detectors) {
            if (d.isAvailable()) {
                available++;
            }
        }
        if (available == detectors.size()) {
            return EnsembleHealth.HEALTHY;
        }
        return available == 0 ? EnsembleHealth.UNHEALTHY : EnsembleHealth.DEGRADED;
    }

    // ---------------------------------------------------------------
    // Scoring
    // ---------------------------------------------------------------

    /**
     * Score one tick.
     *
     * @param assetId   asset the input belongs to
     * @param input     normalized vector and history
     * @param cuts      decision boundaries to classify against
     * @param lastGood  caller-owned last good score per detector; updated
     *                  with every fresh score
     * @return the classified result
     * @throws NoDetectorAvailableException if no detector contributed
     * @throws DetectorTimeoutException     if a detector timed out under
     *                                      {@link FallbackPolicy#FAIL}
     * @throws ComputationException         if a detector failed under
     *                                      {@link FallbackPolicy#FAIL}
     */
    public EnsembleResult score(String assetId, DetectorInput input, AlertCuts cuts, Map<String, Double> lastGood) {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(cuts, "cuts must not be null");
        Objects.requireNonNull(lastGood, "lastGood must not be null");
        EnsembleWeights snapshot = weights;

        Map<String, Future<Double>> pending = new LinkedHashMap<>();
        for (AnomalyDetector d : detectors) {
            if (d.isAvailable()) {
                pending.put(d.name(), executor.submit(() -> d.score(input)));
            }
        }

        long deadline = System.nanoTime() + detectorTimeout.toNanos();
        List<DetectorScore> scores = new ArrayList<>(detectors.size());
        try {
            for (AnomalyDetector d : detectors) {
                Future<Double> future = pending.get(d.name());
                if (future == null) {
                    scores.add(DetectorScore.unavailable(d.name(), "model not loaded"));
                    continue;
                }
                scores.add(collect(d.name(), future, deadline, lastGood));
            }
        } finally {
            for (Future<Double> f : pending.values()) {
                f.cancel(true);
            }
        }

        List<String> contributors = new ArrayList<>();
        for (DetectorScore s : scores) {
            if (s.isAvailable()) {
                contributors.add(s.getDetector());
            }
        }
        if (contributors.isEmpty()) {
            throw new NoDetectorAvailableException("No detector produced a score for asset '" + assetId + "'");
        }

        Map<String, Double> applied = snapshot.renormalize(contributors);
        double composite = 0.0;
        for (DetectorScore s : scores) {
            if (s.isAvailable()) {
                composite += applied.get(s.getDetector()) * s.getScore();
            }
        }
        composite = Math.max(0.0, Math.min(1.0, composite));
        AlertLevel level = AlertLevel.classify(composite, cuts.getWarningCut(), cuts.getCriticalCut());

        if (contributors.size() < detectors.size()) {
            LOG.debug("Degraded ensemble for asset '{}': contributors={}", assetId, contributors);
        }

        return EnsembleResult.builder()
                .resultId(UUID.randomUUID().toString())
                .assetId(assetId)
                .timestamp(clock.instant())
                .windowStart(input.current().getWindowStart())
                .detectorScores(scores)
                .appliedWeights(applied)
                .compositeScore(composite)
                .alertLevel(level)
                .cuts(cuts.getWarningCut(), cuts.getCriticalCut(), cuts.isAdaptive())
                .build();
    }

    private DetectorScore collect(String name, Future<Double> future, long deadline, Map<String, Double> lastGood) {
        try {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            double value = future.get(remaining, TimeUnit.NANOSECONDS);
            DetectorScore fresh = DetectorScore.available(name, value);
            lastGood.put(name, value);
            return fresh;
        } catch (TimeoutException e) {
            return onFailure(name, new DetectorTimeoutException(name, detectorTimeout), lastGood);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AvailabilityException unavailable) {
                LOG.debug("Detector '{}' unavailable: {}", name, unavailable.getMessage());
                return DetectorScore.unavailable(name, unavailable.getMessage());
            }
            VibrationSentinelException failure = cause instanceof VibrationSentinelException vse
                    ? vse
                    : new ComputationException("Detector '" + name + "' failed: " + cause, cause);
            return onFailure(name, failure, lastGood);
        } catch (IllegalArgumentException e) {
            return onFailure(name, new ComputationException(e.getMessage(), e), lastGood);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AvailabilityException("Interrupted while waiting for detector '" + name + "'", e);
        }
    }

    private DetectorScore onFailure(String name, VibrationSentinelException failure, Map<String, Double> lastGood) {
        switch (fallback) {
            case FAIL:
                throw failure;
            case REUSE_STALE:
                Double previous = lastGood.get(name);
                if (previous != null) {
                    LOG.warn("Detector '{}' failed ({}), re-using last good score {}", name,
                            failure.getMessage(), previous);
                    return DetectorScore.stale(name, previous, failure.getMessage());
                }
                break;
            default:
                break;
        }
        LOG.warn("Detector '{}' skipped: {}", name, failure.getMessage());
        return DetectorScore.unavailable(name, failure.getMessage());
    }
}
