package com.vibrationsentinel.core.pipeline;

import com.vibrationsentinel.core.calibration.AdaptiveThreshold;
import com.vibrationsentinel.core.config.PipelineConfig;
import com.vibrationsentinel.core.detection.DetectorInput;
import com.vibrationsentinel.core.drift.DriftMonitor;
import com.vibrationsentinel.core.ensemble.AlertCuts;
import com.vibrationsentinel.core.ensemble.FallbackPolicy;
import com.vibrationsentinel.core.error.ComputationException;
import com.vibrationsentinel.core.error.NoDetectorAvailableException;
import com.vibrationsentinel.core.error.VibrationSentinelException;
import com.vibrationsentinel.core.model.DriftEvent;
import com.vibrationsentinel.core.model.EnsembleResult;
import com.vibrationsentinel.core.model.FeatureVector;
import com.vibrationsentinel.core.model.Feedback;
import com.vibrationsentinel.core.model.RawSample;
import com.vibrationsentinel.core.model.RulEstimate;
import com.vibrationsentinel.core.model.Window;
import com.vibrationsentinel.core.rul.HealthHistory;
import com.vibrationsentinel.core.rul.HealthPoint;
import com.vibrationsentinel.core.signal.WindowAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one asset's windows through the full chain: features, normalization,
 * ensemble scoring against the asset's adaptive cuts, drift monitoring and
 * RUL projection.
 *
 * <h3>Failure handling</h3>
 * <ul>
 * <li>A window whose features cannot be computed is dropped; the pipeline
 * carries on.</li>
 * <li>When no detector answers, the ensemble fallback decides between
 * emitting nothing, re-emitting the last result marked stale, or
 * propagating.</li>
 * <li>A fatal error (missing statistics, corrupt state) marks the pipeline
 * failed; it rethrows that error on every further call.</li>
 * </ul>
 *
 * <p>
 * One writer per asset: callers must not invoke a pipeline concurrently.
 * </p>
 *
 * @since 1.0.0
 */
public final class AssetPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(AssetPipeline.class);

    private final String assetId;
    private final PipelineComponents components;
    private final WindowAssembler assembler;
    private final ArrayDeque<FeatureVector> history;
    private final AdaptiveThreshold threshold;
    private final DriftMonitor drift;
    private final HealthHistory health;
    private final Map<String, Double> lastGoodScores;
    private EnsembleResult lastResult;
    private VibrationSentinelException failure;

    public AssetPipeline(String assetId, PipelineComponents components) {
        this(assetId, components, null);
    }

    private AssetPipeline(String assetId, PipelineComponents components, AssetState state) {
        this.assetId = Objects.requireNonNull(assetId, "assetId must not be null");
        this.components = Objects.requireNonNull(components, "components must not be null");
        PipelineConfig config = components.getConfig();

        this.assembler = state != null && state.getAssembler() != null
                ? state.getAssembler().copy()
                : components.getWindower().assembler();
        this.history = new ArrayDeque<>();
        if (state != null && state.getFeatureHistory() != null) {
            for (FeatureVector v : state.getFeatureHistory()) {
                appendHistory(v);
            }
        }
        this.threshold = new AdaptiveThreshold(assetId, config.getThreshold(),
                state != null ? state.getThreshold() : null, components.getClock());
        this.drift = new DriftMonitor(assetId, config.getDrift(), components.getExtractor().schema(),
                state != null ? state.getDrift() : null, components.getExecutor(), components.getClock());
        this.health = new HealthHistory(config.getRul().getMaxHistory());
        if (state != null && state.getHealth() != null) {
            state.getHealth().forEach(health::add);
        }
        this.lastGoodScores = new LinkedHashMap<>();
        if (state != null && state.getLastGoodScores() != null) {
            lastGoodScores.putAll(state.getLastGoodScores());
        }
        this.lastResult = state != null ? state.getLastResult() : null;
    }

    /**
     * Resume a pipeline from a snapshot.
     *
     * @throws com.vibrationsentinel.core.error.StateCorruptionException if the
     *         snapshot fails its invariants
     */
    public static AssetPipeline restore(PipelineComponents components, AssetState state) {
        Objects.requireNonNull(state, "state must not be null");
        AssetPipeline pipeline = new AssetPipeline(state.getAssetId(), components, state);
        LOG.info("Restored pipeline for asset '{}' ({} buffered vectors, cuts {})", pipeline.assetId,
                pipeline.history.size(), pipeline.threshold.currentCuts());
        return pipeline;
    }

    public String getAssetId() {
        return assetId;
    }

    public boolean isFailed() {
        return failure != null;
    }

    public AlertCuts currentCuts() {
        return threshold.currentCuts();
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    /**
     * Feed one raw sample; processes a window whenever one completes.
     *
     * @return the outcome of the completed window, if any
     * @throws com.vibrationsentinel.core.error.InputException if the sample is
     *         not finite
     */
    public Optional<PipelineOutcome> offer(RawSample sample) {
        ensureHealthy();
        Optional<Window> window = assembler.offer(sample);
        if (window.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(process(window.get()));
    }

    /**
     * Process one complete window.
     *
     * @return what the window produced
     * @throws VibrationSentinelException if a fatal error occurs now or
     *                                    occurred earlier, or a collaborator
     *                                    failed under a {@code FAIL} policy
     */
    public PipelineOutcome process(Window window) {
        Objects.requireNonNull(window, "window must not be null");
        ensureHealthy();
        try {
            return doProcess(window);
        } catch (VibrationSentinelException e) {
            if (e.isFatal()) {
                failure = e;
                LOG.error("Pipeline for asset '{}' failed permanently", assetId, e);
            }
            throw e;
        }
    }

    private PipelineOutcome doProcess(Window window) {
        FeatureVector normalized;
        try {
            FeatureVector raw = components.getExtractor().extract(window);
            normalized = components.getNormalizer().normalize(raw);
        } catch (ComputationException e) {
            LOG.warn("Dropping window {} of asset '{}': {}", window.getSequence(), assetId, e.getMessage());
            return PipelineOutcome.dropped(e.getMessage());
        }

        appendHistory(normalized);
        DetectorInput input = new DetectorInput(normalized, new ArrayList<>(history));
        AlertCuts cuts = threshold.currentCuts();

        EnsembleResult result = score(input, cuts, window);
        RulEstimate rul = null;
        if (result != null) {
            threshold.recordPrediction(result);
            if (!result.isStale()) {
                lastResult = result;
                health.add(new HealthPoint(window.getStart(), result.getHealth()));
                rul = components.getRulEstimator().estimate(assetId, health.snapshot(), result.getTimestamp());
            }
            LOG.debug("Asset '{}' window {}: composite={} level={} contributors={}", assetId,
                    window.getSequence(), result.getCompositeScore(), result.getAlertLevel(),
                    result.getContributors());
        }

        DriftEvent event = drift.observe(normalized).orElse(null);
        return PipelineOutcome.of(result, event, rul);
    }

    private EnsembleResult score(DetectorInput input, AlertCuts cuts, Window window) {
        try {
            return components.getScorer().score(assetId, input, cuts, lastGoodScores);
        } catch (NoDetectorAvailableException e) {
            FallbackPolicy policy = components.getConfig().getEnsemble().getUnavailableFallback();
            if (policy == FallbackPolicy.FAIL) {
                throw e;
            }
            if (policy == FallbackPolicy.REUSE_STALE && lastResult != null) {
                LOG.warn("No detector available for asset '{}', re-emitting last result as stale", assetId);
                return lastResult.toBuilder()
                        .resultId(UUID.randomUUID().toString())
                        .timestamp(components.getClock().instant())
                        .windowStart(window.getStart())
                        .stale(true)
                        .build();
            }
            LOG.warn("No detector available for asset '{}', no result for window {}", assetId, window.getSequence());
            return null;
        }
    }

    /**
     * Apply operator feedback to this asset's cuts.
     *
     * @return {@code true} if the cuts changed
     */
    public boolean onFeedback(Feedback feedback) {
        ensureHealthy();
        return threshold.onFeedback(feedback);
    }

    /**
     * @return a self-contained copy of this pipeline's state
     */
    public AssetState snapshot() {
        AssetState state = new AssetState();
        state.setAssetId(assetId);
        state.setAssembler(assembler.copy());
        state.setFeatureHistory(new ArrayList<>(history));
        state.setThreshold(threshold.snapshot());
        state.setDrift(drift.snapshot());
        state.setHealth(health.snapshot());
        state.setLastGoodScores(new LinkedHashMap<>(lastGoodScores));
        state.setLastResult(lastResult);
        return state;
    }

    List<FeatureVector> history() {
        return new ArrayList<>(history);
    }

    private void appendHistory(FeatureVector v) {
        history.addLast(v);
        while (history.size() > components.getHistoryCapacity()) {
            history.pollFirst();
        }
    }

    private void ensureHealthy() {
        if (failure != null) {
            throw failure;
        }
    }
}
