package com.vibrationsentinel.core.pipeline;

import com.vibrationsentinel.core.config.PipelineConfig;
import com.vibrationsentinel.core.detection.AnomalyDetector;
import com.vibrationsentinel.core.detection.FeatureLayout;
import com.vibrationsentinel.core.detection.MissingModelDetector;
import com.vibrationsentinel.core.detection.TemporalDetector;
import com.vibrationsentinel.core.ensemble.EnsembleScorer;
import com.vibrationsentinel.core.ensemble.EnsembleWeights;
import com.vibrationsentinel.core.model.FeatureSchema;
import com.vibrationsentinel.core.normalization.Normalizer;
import com.vibrationsentinel.core.registry.ModelRegistry;
import com.vibrationsentinel.core.rul.RulEstimator;
import com.vibrationsentinel.core.signal.FeatureExtractor;
import com.vibrationsentinel.core.signal.Windower;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Read-only collaborators shared by every {@link AssetPipeline}: the
 * windowing geometry, feature extractor, normalizer, ensemble and RUL
 * estimator, plus the executor bounded calls run on.
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #create(PipelineConfig, ModelRegistry, ExecutorService)} to
 * wire everything from a registry, or the {@link Builder} to supply
 * individual pieces (tests, tools). The executor is owned by the caller.
 * </p>
 *
 * @since 1.0.0
 */
public final class PipelineComponents {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineComponents.class);

    private final PipelineConfig config;
    private final Windower windower;
    private final FeatureExtractor extractor;
    private final Normalizer normalizer;
    private final EnsembleScorer scorer;
    private final RulEstimator rulEstimator;
    private final ExecutorService executor;
    private final Clock clock;
    private final int historyCapacity;

    private PipelineComponents(Builder b) {
        this.config = Objects.requireNonNull(b.config, "config must not be null");
        this.executor = Objects.requireNonNull(b.executor, "executor must not be null");
        this.normalizer = Objects.requireNonNull(b.normalizer, "normalizer must not be null");
        Objects.requireNonNull(b.detectors, "detectors must not be null");
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
        this.windower = Windower.from(config.getWindowing());
        this.extractor = FeatureExtractor.from(config.getFeatures());
        this.rulEstimator = RulEstimator.from(config.getRul());
        PipelineConfig.Ensemble ens = config.getEnsemble();
        List<AnomalyDetector> detectors = matchToSchema(b.detectors, extractor.schema());
        this.scorer = new EnsembleScorer(detectors, new EnsembleWeights(ens.weightMap()), executor,
                Duration.ofMillis(ens.getDetectorTimeoutMs()), ens.getDetectorFallback(), clock);

        int capacity = config.getDetectors().getSequenceLength();
        for (AnomalyDetector d : detectors) {
            if (d instanceof TemporalDetector temporal) {
                capacity = Math.max(capacity, temporal.requiredHistory());
            }
        }
        this.historyCapacity = capacity;
    }

    /**
     * Wire components from published artifacts. Missing normalization
     * statistics leave the normalizer unfitted, which fails every asset on
     * its first window.
     */
    public static PipelineComponents create(PipelineConfig config, ModelRegistry registry, ExecutorService executor) {
        Objects.requireNonNull(registry, "registry must not be null");
        Normalizer normalizer = registry.normalizationStats()
                .map(Normalizer::new)
                .orElseGet(() -> {
                    LOG.warn("Registry has no normalization statistics; pipelines will fail on first window");
                    return new Normalizer();
                });
        return builder()
                .config(config)
                .normalizer(normalizer)
                .detectors(registry.detectors())
                .executor(executor)
                .build();
    }

    /**
     * Replace detectors whose model reads features the extractor does not
     * produce with a {@link MissingModelDetector}.
     */
    static List<AnomalyDetector> matchToSchema(List<AnomalyDetector> detectors, FeatureSchema schema) {
        List<AnomalyDetector> matched = new ArrayList<>(detectors.size());
        for (AnomalyDetector d : detectors) {
            Optional<FeatureLayout> layout = d.inputLayout();
            List<String> missing = layout.isPresent() ? layout.get().missingFrom(schema) : List.of();
            if (missing.isEmpty()) {
                matched.add(d);
            } else {
                LOG.warn("Detector '{}' disabled: extracted features lack model inputs {}", d.name(), missing);
                matched.add(new MissingModelDetector(d.name(), "feature schema lacks model inputs " + missing));
            }
        }
        return matched;
    }

    public static Builder builder() {
        return new Builder();
    }

    public PipelineConfig getConfig() {
        return config;
    }

    public Windower getWindower() {
        return windower;
    }

    public FeatureExtractor getExtractor() {
        return extractor;
    }

    public Normalizer getNormalizer() {
        return normalizer;
    }

    public EnsembleScorer getScorer() {
        return scorer;
    }

    public RulEstimator getRulEstimator() {
        return rulEstimator;
    }

    public ExecutorService getExecutor() {
        return executor;
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * @return number of normalized vectors each asset keeps for sequence
     *         detectors
     */
    public int getHistoryCapacity() {
        return historyCapacity;
    }

    /**
     * Fluent builder for {@link PipelineComponents}.
     */
    public static class Builder {
        private PipelineConfig config;
        private Normalizer normalizer;
        private List<AnomalyDetector> detectors;
        private ExecutorService executor;
        private Clock clock;

        public Builder config(PipelineConfig config) {
            this.config = config;
            return this;
        }

        public Builder normalizer(Normalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder detectors(List<AnomalyDetector> detectors) {
            this.detectors = detectors;
            return this;
        }

        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public PipelineComponents build() {
            return new PipelineComponents(this);
        }
    }
}
