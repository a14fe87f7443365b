package com.vibrationsentinel.flink;

import com.vibrationsentinel.core.config.PipelineConfig;
import com.vibrationsentinel.core.ensemble.EnsembleScorer;
import com.vibrationsentinel.core.error.InputException;
import com.vibrationsentinel.core.error.VibrationSentinelException;
import com.vibrationsentinel.core.model.AlertLevel;
import com.vibrationsentinel.core.model.DriftEvent;
import com.vibrationsentinel.core.model.EnsembleResult;
import com.vibrationsentinel.core.model.Feedback;
import com.vibrationsentinel.core.model.RulEstimate;
import com.vibrationsentinel.core.model.Window;
import com.vibrationsentinel.core.pipeline.AssetPipeline;
import com.vibrationsentinel.core.pipeline.PipelineComponents;
import com.vibrationsentinel.core.pipeline.PipelineOutcome;
import com.vibrationsentinel.core.registry.FileModelRegistry;
import com.vibrationsentinel.core.state.ArtifactCodec;
import com.vibrationsentinel.core.signal.WindowAssembler;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.co.KeyedCoProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Core Flink {@link KeyedCoProcessFunction} that hosts one
 * {@link AssetPipeline} per asset.
 *
 * <p>
 * Input 1 carries raw samples, input 2 operator feedback; both are keyed by
 * asset id so one asset always has a single writer. Ensemble results are
 * the main output; drift events and available RUL estimates go to the
 * {@link #DRIFT_EVENTS} and {@link #RUL_ESTIMATES} side outputs.
 * </p>
 *
 * <h3>State Management</h3>
 * <ul>
 * <li>{@code ValueState<WindowAssembler>}: the partial window, updated on
 * every sample.</li>
 * <li>{@code ValueState<CheckpointedAssetState>}: history, health trend
 * and the adaptive cuts and drift reference as versioned envelopes, updated
 * after every processed window and every feedback.</li>
 * </ul>
 * <p>
 * Live pipelines are cached per key and rebuilt from the checkpointed state
 * after a restart. An asset whose state fails to restore has its windows
 * dropped and its feedback ignored until that state is repaired.
 * </p>
 *
 * <h3>Metrics</h3>
 * <p>
 * Custom Flink metrics are registered in {@link #open(Configuration)} and
 * updated on every processed window.
 * </p>
 *
 * @since 1.0.0
 */
public class AssetPipelineFunction
        extends KeyedCoProcessFunction<String, SampleRecord, Feedback, EnsembleResult> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AssetPipelineFunction.class);

    public static final OutputTag<DriftEvent> DRIFT_EVENTS = new OutputTag<DriftEvent>("drift-events") {
    };
    public static final OutputTag<RulEstimate> RUL_ESTIMATES = new OutputTag<RulEstimate>("rul-estimates") {
    };

    private final PipelineConfig pipelineConfig;
    private final String modelDir;
    private final int detectorThreads;

    private transient ValueState<WindowAssembler> assemblerState;
    private transient ValueState<CheckpointedAssetState> pipelineState;
    private transient ArtifactCodec codec;
    private transient AssetPipelines pipelines;
    private transient ExecutorService executor;
    private transient PipelineComponents components;
    private transient PipelineMetrics metrics;

    /**
     * @param pipelineConfig  validated pipeline configuration
     * @param modelDir        directory holding the published model artifacts
     * @param detectorThreads size of the detector pool of each task
     */
    public AssetPipelineFunction(PipelineConfig pipelineConfig, String modelDir, int detectorThreads) {
        this.pipelineConfig = Objects.requireNonNull(pipelineConfig, "pipelineConfig must not be null");
        this.modelDir = Objects.requireNonNull(modelDir, "modelDir must not be null");
        if (detectorThreads < 1) {
            throw new IllegalArgumentException("detectorThreads must be >= 1, got: " + detectorThreads);
        }
        this.detectorThreads = detectorThreads;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        assemblerState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("window-assembler", TypeInformation.of(WindowAssembler.class)));
        pipelineState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("asset-state", TypeInformation.of(CheckpointedAssetState.class)));
        codec = new ArtifactCodec();

        executor = EnsembleScorer.newDetectorExecutor(detectorThreads);
        components = PipelineComponents.create(pipelineConfig,
                new FileModelRegistry(Paths.get(modelDir), codec), executor);
        pipelines = new AssetPipelines(components, codec);

        metrics = new PipelineMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("AssetPipelineFunction opened: models={} ensemble={}", modelDir, components.getScorer().health());
    }

    @Override
    public void close() {
        LOG.info("AssetPipelineFunction closing ({} live pipelines)", pipelines != null ? pipelines.size() : 0);
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement1(SampleRecord record,
            KeyedCoProcessFunction<String, SampleRecord, Feedback, EnsembleResult>.Context ctx,
            Collector<EnsembleResult> out) throws Exception {
        WindowAssembler assembler = assemblerState.value();
        if (assembler == null) {
            assembler = components.getWindower().assembler();
        }
        Optional<Window> window;
        try {
            window = assembler.offer(record.toRawSample());
        } catch (InputException e) {
            LOG.warn("Rejected sample for asset '{}': {}", ctx.getCurrentKey(), e.getMessage());
            return;
        }
        assemblerState.update(assembler);
        if (window.isEmpty()) {
            return;
        }

        long startNanos = System.nanoTime();
        Optional<AssetPipeline> restored = pipelineFor(ctx.getCurrentKey());
        if (restored.isEmpty() || restored.get().isFailed()) {
            metrics.incrementWindowsDropped();
            return;
        }
        AssetPipeline pipeline = restored.get();
        try {
            PipelineOutcome outcome = pipeline.process(window.get());
            emit(outcome, ctx, out);
        } catch (VibrationSentinelException e) {
            metrics.incrementWindowsDropped();
            if (e.isFatal()) {
                LOG.error("Pipeline for asset '{}' failed; dropping its windows until restart",
                        ctx.getCurrentKey(), e);
            } else {
                LOG.warn("Window {} of asset '{}' not scored: {}", window.get().getSequence(),
                        ctx.getCurrentKey(), e.getMessage());
            }
        }
        pipelineState.update(CheckpointedAssetState.of(pipeline.snapshot(), codec));
        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
    }

    @Override
    public void processElement2(Feedback feedback,
            KeyedCoProcessFunction<String, SampleRecord, Feedback, EnsembleResult>.Context ctx,
            Collector<EnsembleResult> out) throws Exception {
        Optional<AssetPipeline> restored = pipelineFor(ctx.getCurrentKey());
        if (restored.isEmpty() || restored.get().isFailed()) {
            LOG.warn("Ignoring feedback '{}' for failed asset '{}'", feedback.getFeedbackId(), ctx.getCurrentKey());
            return;
        }
        AssetPipeline pipeline = restored.get();
        if (pipeline.onFeedback(feedback)) {
            LOG.info("Asset '{}' now classifies against {}", ctx.getCurrentKey(), pipeline.currentCuts());
        }
        pipelineState.update(CheckpointedAssetState.of(pipeline.snapshot(), codec));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private Optional<AssetPipeline> pipelineFor(String assetId) throws Exception {
        return pipelines.pipelineFor(assetId, pipelineState.value());
    }

    private void emit(PipelineOutcome outcome,
            KeyedCoProcessFunction<String, SampleRecord, Feedback, EnsembleResult>.Context ctx,
            Collector<EnsembleResult> out) {
        Optional<EnsembleResult> result = outcome.result();
        if (result.isEmpty()) {
            metrics.incrementWindowsDropped();
        } else {
            EnsembleResult r = result.get();
            out.collect(r);
            metrics.incrementWindowsProcessed();
            if (r.getAlertLevel() != AlertLevel.NORMAL) {
                metrics.incrementAlerts();
                LOG.info("Alert: asset={} level={} composite={}", r.getAssetId(), r.getAlertLevel(),
                        r.getCompositeScore());
            }
            if (r.isDegraded()) {
                metrics.incrementDegradedResults();
            }
        }
        outcome.driftEvent().ifPresent(event -> {
            ctx.output(DRIFT_EVENTS, event);
            metrics.incrementDriftEvents();
        });
        outcome.rulEstimate()
                .filter(RulEstimate::isAvailable)
                .ifPresent(rul -> ctx.output(RUL_ESTIMATES, rul));
    }
}
